package com.secrecon.statement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/** Valued balance-sheet lines keyed by label, split into assets, liabilities and equity. */
public final class BalanceSheet {
    private final LocalDate asOf;
    private final Map<String, BigDecimal> assets;
    private final Map<String, BigDecimal> liabilities;
    private final Map<String, BigDecimal> equity;

    public BalanceSheet(
            LocalDate asOf,
            Map<String, BigDecimal> assets,
            Map<String, BigDecimal> liabilities,
            Map<String, BigDecimal> equity) {
        this.asOf = asOf;
        this.assets = LineItems.copyOf(assets);
        this.liabilities = LineItems.copyOf(liabilities);
        this.equity = LineItems.copyOf(equity);
    }

    /** Latest end date among the valued rows, or {@code null} when none is known. */
    public LocalDate getAsOf() {
        return asOf;
    }

    public Map<String, BigDecimal> getAssets() {
        return assets;
    }

    public Map<String, BigDecimal> getLiabilities() {
        return liabilities;
    }

    public Map<String, BigDecimal> getEquity() {
        return equity;
    }
}
