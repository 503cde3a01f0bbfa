package com.secrecon.validate;

import com.secrecon.model.StatementRow;
import java.math.BigDecimal;
import java.util.List;

final class RowValues {

    private RowValues() {}

    /** Raw value of the first valued row whose tag is listed, trying tags in list order. */
    static BigDecimal firstValue(List<StatementRow> rows, List<String> tags) {
        for (String tag : tags) {
            for (StatementRow row : rows) {
                if (row.hasValue() && tag.equals(row.getTag())) {
                    return row.getValue();
                }
            }
        }
        return null;
    }
}
