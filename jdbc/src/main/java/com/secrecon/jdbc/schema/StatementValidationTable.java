package com.secrecon.jdbc.schema;

import static com.secrecon.jdbc.schema.ColumnDescriptor.bool;
import static com.secrecon.jdbc.schema.ColumnDescriptor.doubleColumn;
import static com.secrecon.jdbc.schema.ColumnDescriptor.integer;
import static com.secrecon.jdbc.schema.ColumnDescriptor.varchar;

import com.secrecon.validate.BatchValidationReport;
import com.secrecon.validate.FilingValidationReport;
import com.secrecon.validate.StatementDiagnostics;
import java.util.ArrayList;
import java.util.List;

/** One row per filing and statement with the outcome of every statement check. */
public final class StatementValidationTable {
    public static final String NAME = "statement_validation";

    private static final TableDefinition DEFINITION = createDefinition();

    private StatementValidationTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(BatchValidationReport batch) {
        List<Object[]> rows = new ArrayList<>();
        for (FilingValidationReport report : batch.getResults().values()) {
            for (StatementDiagnostics diagnostics : report.getStatements().values()) {
                rows.add(
                        new Object[] {
                            report.getFilingId(),
                            SqlValues.code(diagnostics.getStatement()),
                            diagnostics.getCoverage().getRowsTotal(),
                            diagnostics.getCoverage().getRowsWithValue(),
                            diagnostics.getCoverage().getCoverageRatio(),
                            diagnostics.getStructuralParity().isPassed(),
                            diagnostics.getContextCoherence().isPassed(),
                            diagnostics.getContextCoherence().getPeriodContexts(),
                            diagnostics.getContextCoherence().getInstantContexts(),
                            diagnostics.getCandidates().getDuplicateCount(),
                            diagnostics.getCandidates().getConflictCount(),
                            diagnostics.getMissingValues().getExpected().size(),
                            diagnostics.getMissingValues().getUnexpected().size(),
                            diagnostics.getSubtotalChecks().size(),
                            diagnostics.getSubtotalFailures(),
                            diagnostics.isHealthy()
                        });
            }
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(varchar("adsh", false));
        columns.add(varchar("stmt", false));
        columns.add(integer("rows_total", false));
        columns.add(integer("rows_with_value", false));
        columns.add(doubleColumn("coverage_ratio"));
        columns.add(bool("structural_parity", false));
        columns.add(bool("context_coherent", false));
        columns.add(integer("period_contexts", false));
        columns.add(integer("instant_contexts", false));
        columns.add(integer("duplicate_rows", false));
        columns.add(integer("conflict_rows", false));
        columns.add(integer("expected_missing", false));
        columns.add(integer("unexpected_missing", false));
        columns.add(integer("subtotal_checks", false));
        columns.add(integer("subtotal_failures", false));
        columns.add(bool("healthy", false));
        return new TableDefinition(NAME, "TABLE", "Checks per reconstructed statement", columns);
    }
}
