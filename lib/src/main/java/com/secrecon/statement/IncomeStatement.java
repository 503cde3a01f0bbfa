package com.secrecon.statement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/** Valued income-statement lines keyed by label, split into revenues, expenses and income. */
public final class IncomeStatement {
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final Map<String, BigDecimal> revenues;
    private final Map<String, BigDecimal> expenses;
    private final Map<String, BigDecimal> income;

    public IncomeStatement(
            LocalDate periodStart,
            LocalDate periodEnd,
            Map<String, BigDecimal> revenues,
            Map<String, BigDecimal> expenses,
            Map<String, BigDecimal> income) {
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.revenues = LineItems.copyOf(revenues);
        this.expenses = LineItems.copyOf(expenses);
        this.income = LineItems.copyOf(income);
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public LocalDate getPeriodEnd() {
        return periodEnd;
    }

    public Map<String, BigDecimal> getRevenues() {
        return revenues;
    }

    public Map<String, BigDecimal> getExpenses() {
        return expenses;
    }

    public Map<String, BigDecimal> getIncome() {
        return income;
    }
}
