package com.secrecon.jdbc.schema;

import java.util.ArrayList;
import java.util.List;

/** Statement rows whose surviving candidate facts disagreed in value. */
public final class CandidateConflictsView {
    public static final String NAME = "candidate_conflicts";

    private static final TableDefinition DEFINITION = createDefinition();
    private static final String SQL =
            ViewSql.select(DEFINITION, StatementRowsTable.NAME, ViewSql.quoteIdentifier("is_conflict") + " = TRUE");

    private CandidateConflictsView() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static String sql() {
        return SQL;
    }

    private static TableDefinition createDefinition() {
        TableDefinition source = StatementRowsTable.getDefinition();
        List<ColumnDescriptor> columns = new ArrayList<>();
        for (String name :
                List.of("adsh", "stmt", "report", "line", "tag", "value", "ddate", "qtrs", "candidate_count", "candidate_unique_values")) {
            columns.add(source.getColumns().get(source.indexOf(name)));
        }
        return new TableDefinition(NAME, "VIEW", "statement_rows WHERE is_conflict", columns);
    }
}
