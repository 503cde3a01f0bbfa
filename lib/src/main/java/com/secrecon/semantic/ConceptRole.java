package com.secrecon.semantic;

/** Accounting role inferred from the text of a presentation label or a concept tag. */
public enum ConceptRole {
    /** Opening balance of a roll-forward ("beginning of period"). */
    BEGINNING_BALANCE,
    /** Closing balance of a roll-forward ("end of period"). */
    ENDING_BALANCE,
    /** Some balance row that is neither explicitly opening nor closing. */
    BALANCE,
    /** Cash leaving the entity. */
    OUTFLOW,
    /** Cash entering the entity. */
    INFLOW,
    /** Movement that reduces equity. */
    EQUITY_REDUCTION,
    /** Header, text block or policy row that never carries a number. */
    NON_NUMERIC_DISCLOSURE,
    ASSET,
    LIABILITY,
    EQUITY,
    REVENUE,
    EXPENSE,
    /** Earnings, profit or loss line of an income statement. */
    INCOME,
    OPERATING_ACTIVITY,
    INVESTING_ACTIVITY,
    FINANCING_ACTIVITY;

    public boolean isBoundary() {
        return this == BEGINNING_BALANCE || this == ENDING_BALANCE;
    }

    public boolean isBalance() {
        return this == BEGINNING_BALANCE || this == ENDING_BALANCE || this == BALANCE;
    }
}
