package com.secrecon.validate;

import java.util.Collection;
import java.util.Objects;

/** Totals across the statements of one filing, and the status derived from them. */
public final class FilingSummary {
    private final int rowsTotal;
    private final int rowsWithValue;
    private final int structuralFailures;
    private final int contextWarnings;
    private final int duplicateCandidateRows;
    private final int conflictingCandidateRows;
    private final int unexpectedMissingRows;
    private final int subtotalFailures;
    private final ValidationStatus status;

    public FilingSummary(
            int rowsTotal,
            int rowsWithValue,
            int structuralFailures,
            int contextWarnings,
            int duplicateCandidateRows,
            int conflictingCandidateRows,
            int unexpectedMissingRows,
            int subtotalFailures) {
        this.rowsTotal = rowsTotal;
        this.rowsWithValue = rowsWithValue;
        this.structuralFailures = structuralFailures;
        this.contextWarnings = contextWarnings;
        this.duplicateCandidateRows = duplicateCandidateRows;
        this.conflictingCandidateRows = conflictingCandidateRows;
        this.unexpectedMissingRows = unexpectedMissingRows;
        this.subtotalFailures = subtotalFailures;
        this.status = deriveStatus();
    }

    public static FilingSummary of(Collection<StatementDiagnostics> statements) {
        Objects.requireNonNull(statements, "statements");
        int rowsTotal = 0;
        int rowsWithValue = 0;
        int structural = 0;
        int context = 0;
        int duplicates = 0;
        int conflicts = 0;
        int unexpected = 0;
        int subtotals = 0;
        for (StatementDiagnostics diagnostics : statements) {
            rowsTotal += diagnostics.getCoverage().getRowsTotal();
            rowsWithValue += diagnostics.getCoverage().getRowsWithValue();
            if (!diagnostics.getStructuralParity().isPassed()) {
                structural++;
            }
            if (!diagnostics.getContextCoherence().isPassed()) {
                context++;
            }
            duplicates += diagnostics.getCandidates().getDuplicateCount();
            conflicts += diagnostics.getCandidates().getConflictCount();
            unexpected += diagnostics.getMissingValues().getUnexpected().size();
            subtotals += diagnostics.getSubtotalFailures();
        }
        return new FilingSummary(rowsTotal, rowsWithValue, structural, context, duplicates, conflicts, unexpected, subtotals);
    }

    private ValidationStatus deriveStatus() {
        if (structuralFailures > 0 || subtotalFailures > 0) {
            return ValidationStatus.FAIL;
        }
        if (contextWarnings > 0 || conflictingCandidateRows > 0) {
            return ValidationStatus.WARN;
        }
        return ValidationStatus.PASS;
    }

    public int getRowsTotal() {
        return rowsTotal;
    }

    public int getRowsWithValue() {
        return rowsWithValue;
    }

    public double getOverallCoverageRatio() {
        return rowsTotal == 0 ? 0.0 : (double) rowsWithValue / rowsTotal;
    }

    public int getStructuralFailures() {
        return structuralFailures;
    }

    public int getContextWarnings() {
        return contextWarnings;
    }

    public int getDuplicateCandidateRows() {
        return duplicateCandidateRows;
    }

    public int getConflictingCandidateRows() {
        return conflictingCandidateRows;
    }

    public int getUnexpectedMissingRows() {
        return unexpectedMissingRows;
    }

    public int getSubtotalFailures() {
        return subtotalFailures;
    }

    public ValidationStatus getStatus() {
        return status;
    }
}
