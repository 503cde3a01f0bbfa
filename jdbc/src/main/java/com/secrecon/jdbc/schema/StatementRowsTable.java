package com.secrecon.jdbc.schema;

import static com.secrecon.jdbc.schema.ColumnDescriptor.bool;
import static com.secrecon.jdbc.schema.ColumnDescriptor.date;
import static com.secrecon.jdbc.schema.ColumnDescriptor.decimal;
import static com.secrecon.jdbc.schema.ColumnDescriptor.integer;
import static com.secrecon.jdbc.schema.ColumnDescriptor.varchar;

import com.secrecon.assemble.StatementTable;
import com.secrecon.model.StatementRow;
import com.secrecon.semantic.SemanticRules;
import java.util.ArrayList;
import java.util.List;

/**
 * Every reconstructed statement row. Column names follow the source tables for the presentation
 * fields; the resolved fields keep the names of the fact they were taken from.
 */
public final class StatementRowsTable {
    public static final String NAME = "statement_rows";

    private static final TableDefinition DEFINITION = createDefinition();

    private StatementRowsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<StatementTable> tables) {
        List<Object[]> rows = new ArrayList<>();
        for (StatementTable table : tables) {
            for (StatementRow row : table.getRows()) {
                rows.add(
                        new Object[] {
                            row.getFilingId(),
                            SqlValues.code(row.getStatement()),
                            row.getReport(),
                            row.getLine(),
                            row.getDepth(),
                            row.getSourceFile(),
                            row.getTag(),
                            row.getVersion(),
                            row.getLabel(),
                            row.isNegating(),
                            row.getValue(),
                            row.getDisplayValue(),
                            row.getFormattedValue(),
                            row.getUnit(),
                            SqlValues.epochDay(row.getEndDate()),
                            row.getDuration(),
                            row.getSegments(),
                            row.getCoreg(),
                            row.getCandidateCount(),
                            row.getCandidateUniqueValues(),
                            row.isConflict(),
                            row.hasValue(),
                            !row.hasValue() && SemanticRules.isNonNumericDisclosure(row.getTag()),
                            table.isSynthesized()
                        });
            }
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(varchar("adsh", false));
        columns.add(varchar("stmt", false));
        columns.add(integer("report", false));
        columns.add(integer("line", false));
        columns.add(integer("inpth", false));
        columns.add(varchar("rfile", true));
        columns.add(varchar("tag", false));
        columns.add(varchar("version", true));
        columns.add(varchar("plabel", true));
        columns.add(bool("negating", false));
        columns.add(decimal("value"));
        columns.add(decimal("display_value"));
        columns.add(varchar("formatted_value", true));
        columns.add(varchar("uom", true));
        columns.add(date("ddate"));
        columns.add(integer("qtrs", true));
        columns.add(varchar("segments", true));
        columns.add(varchar("coreg", true));
        columns.add(integer("candidate_count", false));
        columns.add(integer("candidate_unique_values", false));
        columns.add(bool("is_conflict", false));
        columns.add(bool("has_value", false));
        columns.add(bool("expected_missing", false));
        columns.add(bool("synthesized", false));
        return new TableDefinition(NAME, "TABLE", "Reconstructed statement rows", columns);
    }
}
