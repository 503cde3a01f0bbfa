package com.secrecon.statement;

import com.secrecon.model.StatementRow;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class LineItems {
    private LineItems() {}

    static Map<String, BigDecimal> copyOf(Map<String, BigDecimal> items) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    /** Adds the row's signed value under its label. A repeated label keeps its place and takes the later value. */
    static void put(Map<String, BigDecimal> items, StatementRow row) {
        String key = row.getLabel() != null ? row.getLabel() : row.getTag();
        items.put(key, row.getDisplayValue());
    }
}
