package com.secrecon.validate;

import com.secrecon.model.StatementRow;

/** Points at one reconstructed row for inspection. */
public final class RowReference {
    private final int report;
    private final int line;
    private final String tag;
    private final int candidateCount;
    private final int candidateUniqueValues;

    public RowReference(int report, int line, String tag, int candidateCount, int candidateUniqueValues) {
        this.report = report;
        this.line = line;
        this.tag = tag;
        this.candidateCount = candidateCount;
        this.candidateUniqueValues = candidateUniqueValues;
    }

    static RowReference of(StatementRow row) {
        return new RowReference(
                row.getReport(), row.getLine(), row.getTag(), row.getCandidateCount(), row.getCandidateUniqueValues());
    }

    public int getReport() {
        return report;
    }

    public int getLine() {
        return line;
    }

    public String getTag() {
        return tag;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public int getCandidateUniqueValues() {
        return candidateUniqueValues;
    }

    @Override
    public String toString() {
        return report + "/" + line + " " + tag;
    }
}
