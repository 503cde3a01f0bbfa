package com.secrecon.validate;

import com.secrecon.model.StatementCode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Aggregate health figures of a batch run. */
public final class BatchScoreboard {

    /** Pass counts of one statement code across the batch. */
    public static final class StatementHealth {
        private final int passCount;
        private final int totalCount;

        StatementHealth(int passCount, int totalCount) {
            this.passCount = passCount;
            this.totalCount = totalCount;
        }

        public int getPassCount() {
            return passCount;
        }

        public int getTotalCount() {
            return totalCount;
        }

        public double getPassRatio() {
            return totalCount == 0 ? 0.0 : (double) passCount / totalCount;
        }
    }

    private final int batchCount;
    private final StatusTally statusCounts;
    private final double averageCoverageRatio;
    private final double minimumCoverageRatio;
    private final int structuralFailures;
    private final int contextWarnings;
    private final int subtotalFailures;
    private final int duplicateCandidateRows;
    private final Map<StatementCode, StatementHealth> statementHealth;

    private BatchScoreboard(
            int batchCount,
            StatusTally statusCounts,
            double averageCoverageRatio,
            double minimumCoverageRatio,
            int structuralFailures,
            int contextWarnings,
            int subtotalFailures,
            int duplicateCandidateRows,
            Map<StatementCode, StatementHealth> statementHealth) {
        this.batchCount = batchCount;
        this.statusCounts = statusCounts;
        this.averageCoverageRatio = averageCoverageRatio;
        this.minimumCoverageRatio = minimumCoverageRatio;
        this.structuralFailures = structuralFailures;
        this.contextWarnings = contextWarnings;
        this.subtotalFailures = subtotalFailures;
        this.duplicateCandidateRows = duplicateCandidateRows;
        this.statementHealth = statementHealth;
    }

    public static BatchScoreboard summarize(BatchValidationReport batch) {
        Objects.requireNonNull(batch, "batch");
        double coverageSum = 0.0;
        double coverageMin = Double.NaN;
        int coverageCount = 0;
        int structural = 0;
        int context = 0;
        int subtotals = 0;
        int duplicates = 0;
        Map<StatementCode, int[]> health = new TreeMap<>();
        for (FilingValidationReport report : batch.getResults().values()) {
            FilingSummary summary = report.getSummary();
            structural += summary.getStructuralFailures();
            context += summary.getContextWarnings();
            subtotals += summary.getSubtotalFailures();
            duplicates += summary.getDuplicateCandidateRows();
            for (StatementDiagnostics diagnostics : report.getStatements().values()) {
                double ratio = diagnostics.getCoverage().getCoverageRatio();
                coverageSum += ratio;
                coverageMin = coverageCount == 0 ? ratio : Math.min(coverageMin, ratio);
                coverageCount++;
                int[] counts = health.computeIfAbsent(diagnostics.getStatement(), code -> new int[2]);
                counts[1]++;
                if (diagnostics.isHealthy()) {
                    counts[0]++;
                }
            }
        }
        Map<StatementCode, StatementHealth> statementHealth = new LinkedHashMap<>();
        health.forEach((code, counts) -> statementHealth.put(code, new StatementHealth(counts[0], counts[1])));
        return new BatchScoreboard(
                batch.getCount(),
                batch.getStatusCounts(),
                coverageCount == 0 ? 0.0 : coverageSum / coverageCount,
                coverageCount == 0 ? 0.0 : coverageMin,
                structural,
                context,
                subtotals,
                duplicates,
                Collections.unmodifiableMap(statementHealth));
    }

    public int getBatchCount() {
        return batchCount;
    }

    public StatusTally getStatusCounts() {
        return statusCounts;
    }

    public double getAverageCoverageRatio() {
        return averageCoverageRatio;
    }

    public double getMinimumCoverageRatio() {
        return minimumCoverageRatio;
    }

    public int getStructuralFailures() {
        return structuralFailures;
    }

    public int getContextWarnings() {
        return contextWarnings;
    }

    public int getSubtotalFailures() {
        return subtotalFailures;
    }

    public int getDuplicateCandidateRows() {
        return duplicateCandidateRows;
    }

    /** Health per statement code, in code order. */
    public Map<StatementCode, StatementHealth> getStatementHealth() {
        return statementHealth;
    }

    /** Multi-line plain-text rendering for command-line output. */
    public String render() {
        StringBuilder out = new StringBuilder();
        out.append("filings: ").append(batchCount).append('\n');
        out.append("status: ").append(statusCounts).append('\n');
        out.append(String.format(Locale.ROOT, "coverage: avg=%.4f min=%.4f%n", averageCoverageRatio, minimumCoverageRatio));
        out.append("structural failures: ").append(structuralFailures).append('\n');
        out.append("context warnings: ").append(contextWarnings).append('\n');
        out.append("subtotal failures: ").append(subtotalFailures).append('\n');
        out.append("duplicate candidate rows: ").append(duplicateCandidateRows).append('\n');
        statementHealth.forEach(
                (code, entry) ->
                        out.append(
                                String.format(
                                        Locale.ROOT,
                                        "  %-4s %d/%d (%.2f)%n",
                                        code,
                                        entry.getPassCount(),
                                        entry.getTotalCount(),
                                        entry.getPassRatio())));
        return out.toString();
    }
}
