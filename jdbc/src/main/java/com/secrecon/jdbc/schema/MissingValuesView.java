package com.secrecon.jdbc.schema;

import java.util.ArrayList;
import java.util.List;

/** Statement rows without a value, with their expected / unexpected classification. */
public final class MissingValuesView {
    public static final String NAME = "missing_values";

    private static final TableDefinition DEFINITION = createDefinition();
    private static final String SQL =
            ViewSql.select(DEFINITION, StatementRowsTable.NAME, ViewSql.quoteIdentifier("has_value") + " = FALSE");

    private MissingValuesView() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static String sql() {
        return SQL;
    }

    private static TableDefinition createDefinition() {
        TableDefinition source = StatementRowsTable.getDefinition();
        List<ColumnDescriptor> columns = new ArrayList<>();
        for (String name : List.of("adsh", "stmt", "report", "line", "tag", "plabel", "ddate", "qtrs", "expected_missing")) {
            columns.add(source.getColumns().get(source.indexOf(name)));
        }
        return new TableDefinition(NAME, "VIEW", "statement_rows WHERE NOT has_value", columns);
    }
}
