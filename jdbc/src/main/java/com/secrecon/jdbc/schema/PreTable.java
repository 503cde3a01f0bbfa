package com.secrecon.jdbc.schema;

import static com.secrecon.jdbc.schema.ColumnDescriptor.bool;
import static com.secrecon.jdbc.schema.ColumnDescriptor.integer;
import static com.secrecon.jdbc.schema.ColumnDescriptor.varchar;

import com.secrecon.model.PresentationRow;
import java.util.ArrayList;
import java.util.List;

/** Typed rows of the presentation table, in filing, statement and display order. */
public final class PreTable {
    public static final String NAME = "pre";

    private static final TableDefinition DEFINITION = createDefinition();

    private PreTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<PresentationRow> presentation) {
        List<Object[]> rows = new ArrayList<>(presentation.size());
        for (PresentationRow row : presentation) {
            rows.add(
                    new Object[] {
                        row.getFilingId(),
                        row.getReport(),
                        row.getLine(),
                        SqlValues.code(row.getStatement()),
                        row.getDepth(),
                        row.getSourceFile(),
                        row.getTag(),
                        row.getVersion(),
                        row.getLabel(),
                        row.isNegating()
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(varchar("adsh", false));
        columns.add(integer("report", false));
        columns.add(integer("line", false));
        columns.add(varchar("stmt", false));
        columns.add(integer("inpth", false));
        columns.add(varchar("rfile", true));
        columns.add(varchar("tag", false));
        columns.add(varchar("version", true));
        columns.add(varchar("plabel", true));
        columns.add(bool("negating", false));
        return new TableDefinition(NAME, "TABLE", "Presentation of statements", columns);
    }
}
