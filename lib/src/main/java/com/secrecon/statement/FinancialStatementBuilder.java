package com.secrecon.statement;

import com.secrecon.assemble.StatementTable;
import com.secrecon.engine.EngineOptions;
import com.secrecon.engine.StatementEngine;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import com.secrecon.model.SubmissionRecord;
import com.secrecon.resolve.FilingPeriod;
import com.secrecon.semantic.ConceptRole;
import com.secrecon.semantic.SemanticRules;
import com.secrecon.store.FilingDataset;
import com.secrecon.store.SubmissionIndex;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Groups the valued rows of reconstructed balance sheets, income statements and cash-flow
 * statements into typed statements. A statement is absent when its reconstruction has no rows at
 * all; rows whose tag falls in no section are left out.
 */
public final class FinancialStatementBuilder {
    private static final Logger LOGGER = Logger.getLogger(FinancialStatementBuilder.class.getName());

    private final StatementEngine engine;
    private final FilingPeriod periods;
    private final SubmissionIndex submissions;

    public FinancialStatementBuilder(StatementEngine engine, FilingPeriod periods, SubmissionIndex submissions) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.periods = Objects.requireNonNull(periods, "periods");
        this.submissions = Objects.requireNonNull(submissions, "submissions");
    }

    public static FinancialStatementBuilder over(FilingDataset dataset, EngineOptions options) {
        return new FinancialStatementBuilder(
                StatementEngine.over(dataset, options),
                new FilingPeriod(dataset.getFacts(), dataset.getSubmissions()),
                dataset.getSubmissions());
    }

    public Optional<BalanceSheet> balanceSheet(String filingId) {
        return balanceSheet(filingId, null);
    }

    /**
     * @param asOf reported date to use instead of the latest valued end date, or {@code null}; the
     *     rows still come from the inferred context
     */
    public Optional<BalanceSheet> balanceSheet(String filingId, LocalDate asOf) {
        StatementTable table = reconstruct(filingId, StatementCode.BS);
        if (table.isEmpty()) {
            return Optional.empty();
        }
        List<StatementRow> values = valued(table);
        Map<String, BigDecimal> assets = new LinkedHashMap<>();
        Map<String, BigDecimal> liabilities = new LinkedHashMap<>();
        Map<String, BigDecimal> equity = new LinkedHashMap<>();
        for (StatementRow row : values) {
            Optional<ConceptRole> section = SemanticRules.balanceSheetSection(row.getTag());
            if (section.isEmpty()) {
                continue;
            }
            switch (section.get()) {
                case ASSET -> LineItems.put(assets, row);
                case LIABILITY -> LineItems.put(liabilities, row);
                case EQUITY -> LineItems.put(equity, row);
                default -> throw new IllegalStateException("Unexpected balance-sheet section " + section.get());
            }
        }
        LocalDate reported = asOf != null ? asOf : endDate(table, values);
        return Optional.of(new BalanceSheet(reported, assets, liabilities, equity));
    }

    public Optional<IncomeStatement> incomeStatement(String filingId) {
        return incomeStatement(filingId, null, null);
    }

    /**
     * @param periodStart start to report instead of the derived one, or {@code null}
     * @param periodEnd end to report instead of the latest valued end date, or {@code null}
     */
    public Optional<IncomeStatement> incomeStatement(String filingId, LocalDate periodStart, LocalDate periodEnd) {
        StatementTable table = reconstruct(filingId, StatementCode.IS);
        if (table.isEmpty()) {
            return Optional.empty();
        }
        List<StatementRow> values = valued(table);
        Map<String, BigDecimal> revenues = new LinkedHashMap<>();
        Map<String, BigDecimal> expenses = new LinkedHashMap<>();
        Map<String, BigDecimal> income = new LinkedHashMap<>();
        for (StatementRow row : values) {
            Optional<ConceptRole> section = SemanticRules.incomeStatementSection(row.getTag());
            if (section.isEmpty()) {
                continue;
            }
            switch (section.get()) {
                case REVENUE -> LineItems.put(revenues, row);
                case EXPENSE -> LineItems.put(expenses, row);
                case INCOME -> LineItems.put(income, row);
                default -> throw new IllegalStateException("Unexpected income-statement section " + section.get());
            }
        }
        LocalDate end = endDate(table, values);
        LocalDate start = periodStart(end, modalDuration(values));
        return Optional.of(
                new IncomeStatement(
                        periodStart != null ? periodStart : start,
                        periodEnd != null ? periodEnd : end,
                        revenues,
                        expenses,
                        income));
    }

    public Optional<CashFlowStatement> cashFlow(String filingId) {
        return cashFlow(filingId, null, null);
    }

    /** Same period handling as {@link #incomeStatement(String, LocalDate, LocalDate)}. */
    public Optional<CashFlowStatement> cashFlow(String filingId, LocalDate periodStart, LocalDate periodEnd) {
        StatementTable table = reconstruct(filingId, StatementCode.CF);
        if (table.isEmpty()) {
            return Optional.empty();
        }
        List<StatementRow> values = valued(table);
        Map<String, BigDecimal> operating = new LinkedHashMap<>();
        Map<String, BigDecimal> investing = new LinkedHashMap<>();
        Map<String, BigDecimal> financing = new LinkedHashMap<>();
        for (StatementRow row : values) {
            Optional<ConceptRole> section = SemanticRules.cashFlowSection(row.getTag());
            if (section.isEmpty()) {
                continue;
            }
            switch (section.get()) {
                case OPERATING_ACTIVITY -> LineItems.put(operating, row);
                case INVESTING_ACTIVITY -> LineItems.put(investing, row);
                case FINANCING_ACTIVITY -> LineItems.put(financing, row);
                default -> throw new IllegalStateException("Unexpected cash-flow section " + section.get());
            }
        }
        LocalDate end = endDate(table, values);
        LocalDate start = periodStart(end, modalDuration(values));
        return Optional.of(
                new CashFlowStatement(
                        periodStart != null ? periodStart : start,
                        periodEnd != null ? periodEnd : end,
                        operating,
                        investing,
                        financing));
    }

    /** All three statements with the filing date taken from the submission index. */
    public Optional<FinancialStatement> fullStatement(String filingId) {
        return fullStatement(filingId, null);
    }

    /**
     * All three statements of a filing, or empty when none of them has rows.
     *
     * @param filingDate filing date to report, or {@code null} to use the submission's
     */
    public Optional<FinancialStatement> fullStatement(String filingId, LocalDate filingDate) {
        Objects.requireNonNull(filingId, "filingId");
        BalanceSheet balanceSheet = balanceSheet(filingId).orElse(null);
        IncomeStatement incomeStatement = incomeStatement(filingId).orElse(null);
        CashFlowStatement cashFlow = cashFlow(filingId).orElse(null);
        if (balanceSheet == null && incomeStatement == null && cashFlow == null) {
            LOGGER.log(Level.FINE, "No statements to group for {0}", filingId);
            return Optional.empty();
        }
        SubmissionRecord company = submissions.find(filingId).orElse(null);
        LocalDate filed = filingDate != null ? filingDate : company == null ? null : company.getFiled();
        return Optional.of(
                new FinancialStatement(
                        filingId,
                        company,
                        periods.describe(filingId).orElse(null),
                        filed,
                        balanceSheet,
                        incomeStatement,
                        cashFlow));
    }

    private StatementTable reconstruct(String filingId, StatementCode statement) {
        Objects.requireNonNull(filingId, "filingId");
        return engine.reconstructTable(filingId, statement, null, null);
    }

    private static List<StatementRow> valued(StatementTable table) {
        List<StatementRow> values = new ArrayList<>();
        for (StatementRow row : table.getRows()) {
            if (row.hasValue()) {
                values.add(row);
            }
        }
        return values;
    }

    /** Latest end date of the valued rows, else the statement's own end date. */
    static LocalDate endDate(StatementTable table, List<StatementRow> values) {
        LocalDate latest = null;
        for (StatementRow row : values) {
            if (row.getEndDate() != null && (latest == null || row.getEndDate().isAfter(latest))) {
                latest = row.getEndDate();
            }
        }
        return latest != null ? latest : table.getContext().getEndDate();
    }

    /**
     * Most frequent duration among the valued rows, the shortest on a tie; one quarter when no row
     * has a value and {@code null} when valued rows carry no duration.
     */
    static Integer modalDuration(List<StatementRow> values) {
        if (values.isEmpty()) {
            return 1;
        }
        Map<Integer, Integer> counts = new TreeMap<>();
        for (StatementRow row : values) {
            if (row.getDuration() != null) {
                counts.merge(row.getDuration(), 1, Integer::sum);
            }
        }
        Integer mode = null;
        int best = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mode = entry.getKey();
            }
        }
        return mode;
    }

    /** First day of a span of {@code quarters} ending on {@code end}; the end itself for instants. */
    static LocalDate periodStart(LocalDate end, Integer quarters) {
        if (end == null) {
            return null;
        }
        if (quarters == null || quarters <= 0) {
            return end;
        }
        return end.minusMonths(3L * quarters).plusDays(1);
    }
}
