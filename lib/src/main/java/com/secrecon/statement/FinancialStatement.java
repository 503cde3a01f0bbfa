package com.secrecon.statement;

import com.secrecon.model.SubmissionRecord;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** The typed statements of one filing together with who filed it and for which period. */
public final class FinancialStatement {
    private final String filingId;
    private final SubmissionRecord company;
    private final String period;
    private final LocalDate filingDate;
    private final BalanceSheet balanceSheet;
    private final IncomeStatement incomeStatement;
    private final CashFlowStatement cashFlow;

    public FinancialStatement(
            String filingId,
            SubmissionRecord company,
            String period,
            LocalDate filingDate,
            BalanceSheet balanceSheet,
            IncomeStatement incomeStatement,
            CashFlowStatement cashFlow) {
        this.filingId = Objects.requireNonNull(filingId, "filingId");
        this.company = company;
        this.period = period;
        this.filingDate = filingDate;
        this.balanceSheet = balanceSheet;
        this.incomeStatement = incomeStatement;
        this.cashFlow = cashFlow;
    }

    public String getFilingId() {
        return filingId;
    }

    /** Submission header of the filer, absent when the dataset has no entry for the filing. */
    public Optional<SubmissionRecord> getCompany() {
        return Optional.ofNullable(company);
    }

    /** Period label such as {@code Q3-2024}; {@code null} when it cannot be derived. */
    public String getPeriod() {
        return period;
    }

    public LocalDate getFilingDate() {
        return filingDate;
    }

    public Optional<BalanceSheet> getBalanceSheet() {
        return Optional.ofNullable(balanceSheet);
    }

    public Optional<IncomeStatement> getIncomeStatement() {
        return Optional.ofNullable(incomeStatement);
    }

    public Optional<CashFlowStatement> getCashFlow() {
        return Optional.ofNullable(cashFlow);
    }

    public Map<String, String> getMetadata() {
        return Map.of("adsh", filingId);
    }
}
