package com.secrecon.jdbc.schema;

import static com.secrecon.jdbc.schema.ColumnDescriptor.doubleColumn;
import static com.secrecon.jdbc.schema.ColumnDescriptor.integer;
import static com.secrecon.jdbc.schema.ColumnDescriptor.varchar;

import com.secrecon.resolve.FilingPeriod;
import com.secrecon.validate.BatchValidationReport;
import com.secrecon.validate.FilingSummary;
import com.secrecon.validate.FilingValidationReport;
import java.util.ArrayList;
import java.util.List;

/** One row per filing: period label, status and the summary totals behind it. */
public final class FilingValidationTable {
    public static final String NAME = "filing_validation";

    private static final TableDefinition DEFINITION = createDefinition();

    private FilingValidationTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(BatchValidationReport batch, FilingPeriod periods) {
        List<Object[]> rows = new ArrayList<>(batch.getCount());
        for (FilingValidationReport report : batch.getResults().values()) {
            FilingSummary summary = report.getSummary();
            rows.add(
                    new Object[] {
                        report.getFilingId(),
                        periods.describe(report.getFilingId()).orElse(null),
                        report.getStatus().getLabel(),
                        summary.getRowsTotal(),
                        summary.getRowsWithValue(),
                        summary.getOverallCoverageRatio(),
                        summary.getStructuralFailures(),
                        summary.getContextWarnings(),
                        summary.getDuplicateCandidateRows(),
                        summary.getConflictingCandidateRows(),
                        summary.getUnexpectedMissingRows(),
                        summary.getSubtotalFailures()
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(varchar("adsh", false));
        columns.add(varchar("period_label", true));
        columns.add(varchar("status", false));
        columns.add(integer("rows_total", false));
        columns.add(integer("rows_with_value", false));
        columns.add(doubleColumn("coverage_ratio"));
        columns.add(integer("structural_failures", false));
        columns.add(integer("context_warnings", false));
        columns.add(integer("duplicate_candidate_rows", false));
        columns.add(integer("conflicting_candidate_rows", false));
        columns.add(integer("unexpected_missing_rows", false));
        columns.add(integer("subtotal_failures", false));
        return new TableDefinition(NAME, "TABLE", "Validation summary per filing", columns);
    }
}
