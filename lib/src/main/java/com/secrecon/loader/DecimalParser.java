package com.secrecon.loader;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.util.Locale;

/**
 * Locale-neutral parser for the numeric columns of the regulator tables. Values use '.' as the
 * decimal separator and never carry grouping characters.
 */
public final class DecimalParser {

    private static final ThreadLocal<DecimalFormat> FORMAT =
            ThreadLocal.withInitial(DecimalParser::buildFormat);

    private DecimalParser() {}

    /**
     * Parses a decimal string. Returns {@code null} for null/empty input. Throws {@link
     * NumberFormatException} for grouping characters or incomplete parses.
     */
    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.indexOf(',') >= 0) {
            throw new NumberFormatException("Grouping separators not allowed: " + text);
        }
        ParsePosition position = new ParsePosition(0);
        Number parsed = FORMAT.get().parse(trimmed, position);
        if (parsed == null || position.getIndex() != trimmed.length()) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
        if (!(parsed instanceof BigDecimal)) {
            return new BigDecimal(parsed.toString());
        }
        return (BigDecimal) parsed;
    }

    /** Parses a whole number, returning {@code null} for null/empty input. */
    public static Integer parseInteger(String text) {
        BigDecimal value = parse(text);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new NumberFormatException("Not an integer: " + text);
        }
    }

    private static DecimalFormat buildFormat() {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
        symbols.setDecimalSeparator('.');
        DecimalFormat format = new DecimalFormat();
        format.setDecimalFormatSymbols(symbols);
        format.setParseBigDecimal(true);
        format.setGroupingUsed(false);
        format.setMaximumFractionDigits(Integer.MAX_VALUE);
        format.setMaximumIntegerDigits(Integer.MAX_VALUE);
        return format;
    }
}
