package org.mbasiconjava.runtime.runtimetypes;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class BasicValueTest {

    @ParameterizedTest
    @CsvSource({
            "2.5, 2",
            "3.5, 4",
            "-2.5, -2",
            "1.4, 1",
            "1.6, 2",
            "40000, 32767",
            "-40000, -32768"
    })
    void testToIntegerRoundsHalfToEvenAndSaturates(double input, int expected) {
        assertEquals(expected, BasicValue.ofDouble(input).toInteger());
    }

    @Test
    void testFormatNumberAddsSignColumnAndTrailingSpace() {
        assertEquals(" 5 ", BasicValue.formatNumber(5));
        assertEquals("-5 ", BasicValue.formatNumber(-5));
        assertEquals(" 2.5 ", BasicValue.formatNumber(2.5));
        assertEquals("2.5", BasicValue.formatNumberBody(2.5));
    }

    @Test
    void testFloatEqualsIsTolerant() {
        assertTrue(BasicValue.floatEquals(0.1 + 0.2, 0.3));
        assertTrue(BasicValue.floatEquals(1000000.0, 1000000.5));
        assertFalse(BasicValue.floatEquals(1.0, 1.001));
        assertEquals(0, BasicValue.compareNumbers(0.1 + 0.2, 0.3));
        assertEquals(-1, BasicValue.compareNumbers(1, 2));
    }

    @Test
    void testFactoriesNarrowToTheirType() {
        assertEquals(VarType.INTEGER, BasicValue.ofInteger(3).type());
        assertEquals(-1, BasicValue.ofBoolean(true).toInteger());
        assertEquals(0, BasicValue.ofBoolean(false).toInteger());
        assertEquals((double) (float) 0.1, BasicValue.ofSingle(0.1).toNumber());
    }

    @Test
    void testCoercion() {
        assertEquals(BasicValue.ofInteger(4), BasicValue.ofDouble(3.7).coerceTo(VarType.INTEGER));
        assertEquals("", BasicValue.ofDouble(1).coerceTo(VarType.STRING).getString());
        assertEquals(VarType.DOUBLE, BasicValue.ofInteger(1).coerceTo(VarType.DOUBLE).type());
    }

    @Test
    void testDefaults() {
        assertEquals("", BasicValue.defaultFor(VarType.STRING).getString());
        assertEquals(0.0, BasicValue.defaultFor(VarType.SINGLE).toNumber());
        assertFalse(BasicValue.EMPTY_STRING.toBoolean());
        assertTrue(BasicValue.ofString("x").toBoolean());
    }

    @Test
    void testErrorMessages() {
        assertEquals("Division by zero", ErrorCode.message(ErrorCode.DIVISION_BY_ZERO));
        assertEquals("Unprintable error", ErrorCode.message(250));
        BasicRuntimeException e = new BasicRuntimeException(ErrorCode.OUT_OF_DATA, "READ");
        assertEquals("Out of DATA", e.getMessage());
        assertEquals("READ", e.getDetail());
    }
}
