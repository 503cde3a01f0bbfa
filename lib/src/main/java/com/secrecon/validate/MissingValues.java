package com.secrecon.validate;

import com.secrecon.model.StatementRow;
import com.secrecon.semantic.SemanticRules;
import java.util.ArrayList;
import java.util.List;

/**
 * Rows without a value, split into expected ones (headers, text blocks, policies, commitments)
 * and unexpected ones.
 */
public final class MissingValues {
    private final List<RowReference> expected;
    private final List<RowReference> unexpected;

    public MissingValues(List<RowReference> expected, List<RowReference> unexpected) {
        this.expected = List.copyOf(expected);
        this.unexpected = List.copyOf(unexpected);
    }

    public static MissingValues classify(List<StatementRow> rows) {
        List<RowReference> expected = new ArrayList<>();
        List<RowReference> unexpected = new ArrayList<>();
        for (StatementRow row : rows) {
            if (row.hasValue()) {
                continue;
            }
            if (SemanticRules.isNonNumericDisclosure(row.getTag())) {
                expected.add(RowReference.of(row));
            } else {
                unexpected.add(RowReference.of(row));
            }
        }
        return new MissingValues(expected, unexpected);
    }

    public List<RowReference> getExpected() {
        return expected;
    }

    public List<RowReference> getUnexpected() {
        return unexpected;
    }

    /** Whether a row with this tag is expected to have no value. */
    public static boolean isExpectedMissing(String tag) {
        return SemanticRules.isNonNumericDisclosure(tag);
    }
}
