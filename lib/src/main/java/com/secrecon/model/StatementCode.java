package com.secrecon.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Validated statement code as it appears in the {@code stmt} column of the presentation table.
 * Unknown or blank codes are programmer errors and are rejected eagerly.
 */
public final class StatementCode implements Comparable<StatementCode> {

    public static final StatementCode BS = new StatementCode("BS", StatementFamily.BALANCE_SHEET);
    public static final StatementCode IS = new StatementCode("IS", StatementFamily.INCOME_STATEMENT);
    public static final StatementCode CF = new StatementCode("CF", StatementFamily.CASH_FLOW);
    public static final StatementCode EQ = new StatementCode("EQ", StatementFamily.EQUITY);
    public static final StatementCode CI =
            new StatementCode("CI", StatementFamily.COMPREHENSIVE_INCOME);

    /** The five primary statements reconstructed when the caller does not name any. */
    public static final List<StatementCode> CORE = List.of(BS, IS, CF, EQ, CI);

    private final String code;
    private final StatementFamily family;

    private StatementCode(String code, StatementFamily family) {
        this.code = code;
        this.family = family;
    }

    public static StatementCode of(String code) {
        Objects.requireNonNull(code, "code");
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Statement code must not be blank");
        }
        int dash = normalized.indexOf('-');
        String prefix = dash >= 0 ? normalized.substring(0, dash) : normalized;
        StatementFamily family = StatementFamily.forPrefix(prefix);
        if (family == null || (dash >= 0 && dash == normalized.length() - 1)) {
            throw new IllegalArgumentException("Unknown statement code: " + code);
        }
        return new StatementCode(normalized, family);
    }

    /** Parses a comma separated list such as {@code "BS, IS,CF"}. */
    public static List<StatementCode> parseList(String codes) {
        Objects.requireNonNull(codes, "codes");
        List<StatementCode> parsed = new ArrayList<>();
        for (String part : codes.split(",")) {
            if (!part.isBlank()) {
                parsed.add(of(part));
            }
        }
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("No statement codes in: " + codes);
        }
        return List.copyOf(parsed);
    }

    public String getCode() {
        return code;
    }

    public StatementFamily getFamily() {
        return family;
    }

    public boolean isBalanceSheet() {
        return family == StatementFamily.BALANCE_SHEET;
    }

    public boolean isCashFlow() {
        return family == StatementFamily.CASH_FLOW;
    }

    public boolean isEquity() {
        return family == StatementFamily.EQUITY;
    }

    public boolean isComprehensiveIncome() {
        return family == StatementFamily.COMPREHENSIVE_INCOME;
    }

    @Override
    public int compareTo(StatementCode other) {
        return code.compareTo(other.code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatementCode)) {
            return false;
        }
        return code.equals(((StatementCode) o).code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return code;
    }
}
