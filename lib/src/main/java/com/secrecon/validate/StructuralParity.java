package com.secrecon.validate;

import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementRow;
import java.util.List;
import java.util.Objects;

/**
 * Whether the reconstructed (report, line, depth, tag) sequence equals the presentation
 * structure's sequence. Statements without a presentation structure pass as not applicable.
 */
public final class StructuralParity {
    private final boolean applicable;
    private final boolean passed;
    private final int expectedRows;
    private final int actualRows;
    private final int firstMismatch;

    private StructuralParity(boolean applicable, boolean passed, int expectedRows, int actualRows, int firstMismatch) {
        this.applicable = applicable;
        this.passed = passed;
        this.expectedRows = expectedRows;
        this.actualRows = actualRows;
        this.firstMismatch = firstMismatch;
    }

    /**
     * @param structure presentation rows in display order
     * @param rows reconstructed rows
     */
    public static StructuralParity check(List<PresentationRow> structure, List<StatementRow> rows) {
        if (structure.isEmpty()) {
            return new StructuralParity(false, true, 0, rows.size(), -1);
        }
        int common = Math.min(structure.size(), rows.size());
        for (int i = 0; i < common; i++) {
            if (!sameShape(structure.get(i), rows.get(i))) {
                return new StructuralParity(true, false, structure.size(), rows.size(), i);
            }
        }
        if (structure.size() != rows.size()) {
            return new StructuralParity(true, false, structure.size(), rows.size(), common);
        }
        return new StructuralParity(true, true, structure.size(), rows.size(), -1);
    }

    private static boolean sameShape(PresentationRow expected, StatementRow actual) {
        return expected.getReport() == actual.getReport()
                && expected.getLine() == actual.getLine()
                && expected.getDepth() == actual.getDepth()
                && Objects.equals(expected.getTag(), actual.getTag());
    }

    public boolean isApplicable() {
        return applicable;
    }

    public boolean isPassed() {
        return passed;
    }

    public int getExpectedRows() {
        return expectedRows;
    }

    public int getActualRows() {
        return actualRows;
    }

    /** Index of the first differing row, or -1 when the sequences agree. */
    public int getFirstMismatch() {
        return firstMismatch;
    }
}
