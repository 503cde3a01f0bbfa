package com.secrecon.jdbc.schema;

import java.util.List;

/** Builds the SELECT behind a view over a single table. */
final class ViewSql {

    private ViewSql() {}

    static String select(TableDefinition view, String sourceTable, String condition) {
        StringBuilder select = new StringBuilder("SELECT ");
        List<ColumnDescriptor> columns = view.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                select.append(", ");
            }
            select.append(quoteIdentifier(columns.get(i).getName()));
        }
        select.append(" FROM ").append(quoteIdentifier(sourceTable)).append(" WHERE ").append(condition);
        return select.toString();
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
