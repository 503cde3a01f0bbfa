package com.secrecon.statement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/** Valued cash-flow lines keyed by label, split by activity. */
public final class CashFlowStatement {
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final Map<String, BigDecimal> operating;
    private final Map<String, BigDecimal> investing;
    private final Map<String, BigDecimal> financing;

    public CashFlowStatement(
            LocalDate periodStart,
            LocalDate periodEnd,
            Map<String, BigDecimal> operating,
            Map<String, BigDecimal> investing,
            Map<String, BigDecimal> financing) {
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.operating = LineItems.copyOf(operating);
        this.investing = LineItems.copyOf(investing);
        this.financing = LineItems.copyOf(financing);
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public LocalDate getPeriodEnd() {
        return periodEnd;
    }

    public Map<String, BigDecimal> getOperatingActivities() {
        return operating;
    }

    public Map<String, BigDecimal> getInvestingActivities() {
        return investing;
    }

    public Map<String, BigDecimal> getFinancingActivities() {
        return financing;
    }
}
