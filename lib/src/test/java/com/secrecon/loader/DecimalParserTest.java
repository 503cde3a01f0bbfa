package com.secrecon.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

final class DecimalParserTest {

    @Test
    void parsesDotDecimal() {
        assertEquals(0, DecimalParser.parse("1234.56").compareTo(new BigDecimal("1234.56")));
    }

    @Test
    void parsesNegative() {
        assertEquals(0, DecimalParser.parse("-0.50").compareTo(new BigDecimal("-0.5")));
    }

    @Test
    void parsesWholeNumberAsInteger() {
        assertEquals(Integer.valueOf(4), DecimalParser.parseInteger("4"));
    }

    @Test
    void returnsNullForBlank() {
        assertNull(DecimalParser.parse("   "));
        assertNull(DecimalParser.parse(null));
        assertNull(DecimalParser.parseInteger(""));
    }

    @Test
    void rejectsGroupingSeparators() {
        assertThrows(NumberFormatException.class, () -> DecimalParser.parse("1,234.56"));
    }

    @Test
    void rejectsText() {
        assertThrows(NumberFormatException.class, () -> DecimalParser.parse("abc"));
        assertThrows(NumberFormatException.class, () -> DecimalParser.parse("12abc"));
    }

    @Test
    void rejectsFractionalInteger() {
        assertThrows(NumberFormatException.class, () -> DecimalParser.parseInteger("1.5"));
    }
}
