package com.secrecon.model;

/**
 * Statement families recognised in the presentation table. Every statement-specific rule keys off
 * the family, so suffixed codes such as {@code BS-LND} or {@code CF-INDIRECT} behave like their
 * base statement.
 */
public enum StatementFamily {
    BALANCE_SHEET("BS"),
    INCOME_STATEMENT("IS"),
    CASH_FLOW("CF"),
    EQUITY("EQ"),
    COMPREHENSIVE_INCOME("CI"),
    COVER_PAGE("CP"),
    UNCLASSIFIED("UN");

    private final String prefix;

    StatementFamily(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    static StatementFamily forPrefix(String prefix) {
        for (StatementFamily family : values()) {
            if (family.prefix.equals(prefix)) {
                return family;
            }
        }
        return null;
    }
}
