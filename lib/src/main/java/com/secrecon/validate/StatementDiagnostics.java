package com.secrecon.validate;

import com.secrecon.assemble.StatementCoverage;
import com.secrecon.model.StatementCode;
import java.util.List;
import java.util.Objects;

/** Every check run over one reconstructed statement. */
public final class StatementDiagnostics {
    private final StatementCode statement;
    private final StatementCoverage coverage;
    private final StructuralParity structuralParity;
    private final CandidateDiagnostics candidates;
    private final MissingValues missingValues;
    private final ContextCoherence contextCoherence;
    private final List<SubtotalCheck> subtotalChecks;

    public StatementDiagnostics(
            StatementCode statement,
            StatementCoverage coverage,
            StructuralParity structuralParity,
            CandidateDiagnostics candidates,
            MissingValues missingValues,
            ContextCoherence contextCoherence,
            List<SubtotalCheck> subtotalChecks) {
        this.statement = Objects.requireNonNull(statement, "statement");
        this.coverage = Objects.requireNonNull(coverage, "coverage");
        this.structuralParity = Objects.requireNonNull(structuralParity, "structuralParity");
        this.candidates = Objects.requireNonNull(candidates, "candidates");
        this.missingValues = Objects.requireNonNull(missingValues, "missingValues");
        this.contextCoherence = Objects.requireNonNull(contextCoherence, "contextCoherence");
        this.subtotalChecks = List.copyOf(subtotalChecks);
    }

    public StatementCode getStatement() {
        return statement;
    }

    public StatementCoverage getCoverage() {
        return coverage;
    }

    public StructuralParity getStructuralParity() {
        return structuralParity;
    }

    public CandidateDiagnostics getCandidates() {
        return candidates;
    }

    public MissingValues getMissingValues() {
        return missingValues;
    }

    public ContextCoherence getContextCoherence() {
        return contextCoherence;
    }

    public List<SubtotalCheck> getSubtotalChecks() {
        return subtotalChecks;
    }

    public int getSubtotalFailures() {
        int failures = 0;
        for (SubtotalCheck check : subtotalChecks) {
            if (check.isFailed()) {
                failures++;
            }
        }
        return failures;
    }

    /** Structural parity, context coherence and every applicable subtotal check passed. */
    public boolean isHealthy() {
        return structuralParity.isPassed() && contextCoherence.isPassed() && getSubtotalFailures() == 0;
    }
}
