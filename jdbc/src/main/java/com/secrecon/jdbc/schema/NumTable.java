package com.secrecon.jdbc.schema;

import static com.secrecon.jdbc.schema.ColumnDescriptor.date;
import static com.secrecon.jdbc.schema.ColumnDescriptor.decimal;
import static com.secrecon.jdbc.schema.ColumnDescriptor.integer;
import static com.secrecon.jdbc.schema.ColumnDescriptor.varchar;

import com.secrecon.model.NumericFact;
import java.util.ArrayList;
import java.util.List;

/** Typed rows of the numeric fact table, one per {@code num.txt} line. */
public final class NumTable {
    public static final String NAME = "num";

    private static final TableDefinition DEFINITION = createDefinition();

    private NumTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<NumericFact> facts) {
        List<Object[]> rows = new ArrayList<>(facts.size());
        for (NumericFact fact : facts) {
            rows.add(
                    new Object[] {
                        fact.getFilingId(),
                        fact.getTag(),
                        fact.getVersion(),
                        SqlValues.epochDay(fact.getEndDate()),
                        fact.getDuration(),
                        fact.getUnit(),
                        fact.getSegments(),
                        fact.getCoreg(),
                        fact.getValue()
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(varchar("adsh", false));
        columns.add(varchar("tag", false));
        columns.add(varchar("version", true));
        columns.add(date("ddate"));
        columns.add(integer("qtrs", true));
        columns.add(varchar("uom", true));
        columns.add(varchar("segments", true));
        columns.add(varchar("coreg", true));
        columns.add(decimal("value"));
        return new TableDefinition(NAME, "TABLE", "Numeric facts", columns);
    }
}
