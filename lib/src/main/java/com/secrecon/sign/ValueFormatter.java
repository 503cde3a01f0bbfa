package com.secrecon.sign;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Accounting-style rendering of displayed values: two-decimal rounding, thousands grouping,
 * whole numbers without decimals, negatives in parentheses.
 */
public final class ValueFormatter {

    private static final ThreadLocal<DecimalFormat> WHOLE =
            ThreadLocal.withInitial(() -> buildFormat("#,##0"));
    private static final ThreadLocal<DecimalFormat> FRACTIONAL =
            ThreadLocal.withInitial(() -> buildFormat("#,##0.00"));

    private ValueFormatter() {}

    /** Formats a value, returning {@code null} for a {@code null} value. */
    public static String format(BigDecimal value) {
        if (value == null) {
            return null;
        }
        BigDecimal rounded = value.setScale(2, RoundingMode.HALF_EVEN);
        BigDecimal magnitude = rounded.abs();
        boolean whole = magnitude.remainder(BigDecimal.ONE).signum() == 0;
        String text = whole ? WHOLE.get().format(magnitude) : FRACTIONAL.get().format(magnitude);
        return rounded.signum() < 0 ? "(" + text + ")" : text;
    }

    private static DecimalFormat buildFormat(String pattern) {
        DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
        format.setRoundingMode(RoundingMode.HALF_EVEN);
        return format;
    }
}
