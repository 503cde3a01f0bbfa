package com.secrecon.jdbc.schema;

import static com.secrecon.jdbc.schema.ColumnDescriptor.bool;
import static com.secrecon.jdbc.schema.ColumnDescriptor.varchar;

import com.secrecon.model.TagRecord;
import java.util.ArrayList;
import java.util.List;

/** Concept definitions from {@code tag.txt}; empty when the dataset has none. */
public final class TagTable {
    public static final String NAME = "tag";

    private static final TableDefinition DEFINITION = createDefinition();

    private TagTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<TagRecord> tags) {
        List<Object[]> rows = new ArrayList<>(tags.size());
        for (TagRecord tag : tags) {
            rows.add(
                    new Object[] {
                        tag.getTag(),
                        tag.getVersion(),
                        tag.isCustom(),
                        tag.isAbstract(),
                        tag.getDatatype(),
                        tag.getBalanceType(),
                        tag.getLabel(),
                        tag.getDocumentation()
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(varchar("tag", false));
        columns.add(varchar("version", true));
        columns.add(bool("custom", false));
        columns.add(bool("abstract", false));
        columns.add(varchar("datatype", true));
        columns.add(varchar("crdr", true));
        columns.add(varchar("tlabel", true));
        columns.add(varchar("doc", true));
        return new TableDefinition(NAME, "TABLE", "Concept definitions", columns);
    }
}
