package com.secrecon.sign;

import static com.secrecon.testing.Fixtures.dec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

final class ValueFormatterTest {

    @Test
    void wholeValuesDropDecimals() {
        assertEquals("1,000,000", ValueFormatter.format(dec("1000000")));
        assertEquals("1,234", ValueFormatter.format(dec("1234.00")));
        assertEquals("0", ValueFormatter.format(dec("0")));
    }

    @Test
    void negativesUseParentheses() {
        assertEquals("(1,234)", ValueFormatter.format(dec("-1234.0")));
        assertEquals("(0.75)", ValueFormatter.format(dec("-0.75")));
    }

    @Test
    void fractionalValuesKeepTwoDecimals() {
        assertEquals("1,234.50", ValueFormatter.format(dec("1234.5")));
        assertEquals("2.50", ValueFormatter.format(dec("2.5")));
    }

    @Test
    void roundsHalfToEven() {
        assertEquals("0.12", ValueFormatter.format(dec("0.125")));
        assertEquals("0.14", ValueFormatter.format(dec("0.135")));
    }

    @Test
    void roundsTheExactDecimalNotItsBinaryApproximation() {
        assertEquals("1.02", ValueFormatter.format(dec("1.015")));
        assertEquals("2.68", ValueFormatter.format(dec("2.675")));
        assertEquals("(1.02)", ValueFormatter.format(dec("-1.015")));
    }

    @Test
    void valuesThatRoundToZeroLoseTheirSign() {
        assertEquals("0", ValueFormatter.format(dec("-0.004")));
    }

    @Test
    void nullFormatsAsNull() {
        assertNull(ValueFormatter.format(null));
    }
}
