package org.mbasiconjava.backend.interpreter;

import org.junit.jupiter.api.Test;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DelimitedFieldsTest {

    @Test
    void testPlainItemsAreTrimmed() {
        assertEquals(List.of("1", "abc", "3"), DelimitedFields.split(" 1 , abc,3 "));
    }

    @Test
    void testQuotedItemKeepsCommas() {
        assertEquals(List.of("a, b", "c"), DelimitedFields.split("\"a, b\",c"));
    }

    @Test
    void testQuotedItemKeepsSurroundingBlanks() {
        assertEquals(List.of("  hi  ", "x"), DelimitedFields.split(" \"  hi  \" , x"));
    }

    @Test
    void testEmptyLineIsOneEmptyItem() {
        assertEquals(List.of(""), DelimitedFields.split(""));
        assertEquals(List.of("", ""), DelimitedFields.split(","));
    }

    @Test
    void testUnterminatedQuoteIsMalformed() {
        assertNull(DelimitedFields.split("\"abc"));
    }

    @Test
    void testJoinQuotesOnlyStrings() {
        String line = DelimitedFields.join(List.of(
                BasicValue.ofInteger(1), BasicValue.ofString("A"), BasicValue.ofDouble(-2.5)));
        assertEquals("1,\"A\",-2.5", line);
    }

    @Test
    void testJoinEscapesQuotes() {
        assertEquals("\"say \"\"hi\"\"\"", DelimitedFields.join(List.of(BasicValue.ofString("say \"hi\""))));
    }
}
