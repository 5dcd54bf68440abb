package org.mbasiconjava.operators.using;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class UsingFormatterTest {

    static Stream<Arguments> numericFields() {
        return Stream.of(
                Arguments.of("###.##", 3.14159, "  3.14"),
                Arguments.of("###.##", -3.14159, " -3.14"),
                Arguments.of("#,###", 1234, "1,234"),
                Arguments.of("**$##.##", 12.5, "**$12.50"),
                Arguments.of("$$##.##", 7.25, "  $7.25"),
                Arguments.of("##.##-", -5, " 5.00-"),
                Arguments.of("+##", 7, " +7"),
                Arguments.of("##", 123, "%123"),
                Arguments.of("##.##^^^^", 123.45, " 1.23E+02"),
                Arguments.of("Total: ###", 42, "Total:  42")
        );
    }

    @ParameterizedTest
    @MethodSource("numericFields")
    void testNumericField(String format, double value, String expected) {
        assertEquals(expected, UsingFormatter.format(format, List.of(BasicValue.ofDouble(value))));
    }

    @Test
    void testStringFields() {
        BasicValue hello = BasicValue.ofString("HELLO");
        assertEquals("H", UsingFormatter.format("!", List.of(hello)));
        assertEquals("HELLO", UsingFormatter.format("&", List.of(hello)));
        assertEquals("HELL", UsingFormatter.format("\\  \\", List.of(hello)));
        assertEquals("HI  ", UsingFormatter.format("\\  \\", List.of(BasicValue.ofString("HI"))));
    }

    @Test
    void testMixedFieldsConsumeValuesInOrder() {
        String text = UsingFormatter.format("& costs ##.##",
                List.of(BasicValue.ofString("Tea"), BasicValue.ofDouble(1.5)));
        assertEquals("Tea costs  1.50", text);
    }

    @Test
    void testStopsAtFieldWhenValuesRunOut() {
        String text = UsingFormatter.format("A=## B=##", List.of(BasicValue.ofDouble(1)));
        assertEquals("A= 1 B=", text);
    }

    @Test
    void testExtraValuesAreDropped() {
        String text = UsingFormatter.format("##", List.of(BasicValue.ofDouble(1), BasicValue.ofDouble(2)));
        assertEquals(" 1", text);
    }

    @Test
    void testUnderscoreEscapesFieldCharacter() {
        assertEquals("#5", UsingFormatter.format("_##", List.of(BasicValue.ofDouble(5))));
    }

    @Test
    void testFormatWithoutFieldsIsIllegal() {
        BasicRuntimeException e = assertThrows(BasicRuntimeException.class,
                () -> UsingFormatter.format("ABC", List.of(BasicValue.ofDouble(1))));
        assertEquals(ErrorCode.ILLEGAL_FUNCTION_CALL, e.getCode());
    }

    @Test
    void testValueKindMustMatchField() {
        BasicRuntimeException e = assertThrows(BasicRuntimeException.class,
                () -> UsingFormatter.format("###", List.of(BasicValue.ofString("X"))));
        assertEquals(ErrorCode.TYPE_MISMATCH, e.getCode());
    }
}
