package com.secrecon.assemble;

import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** How many rows of a reconstructed statement carry a value. */
public final class StatementCoverage {
    private final StatementCode statement;
    private final int rowsTotal;
    private final int rowsWithValue;
    private final List<String> missingTags;

    public StatementCoverage(StatementCode statement, int rowsTotal, int rowsWithValue, List<String> missingTags) {
        this.statement = Objects.requireNonNull(statement, "statement");
        if (rowsWithValue < 0 || rowsWithValue > rowsTotal) {
            throw new IllegalArgumentException(
                    "rowsWithValue " + rowsWithValue + " outside [0, " + rowsTotal + "]");
        }
        this.rowsTotal = rowsTotal;
        this.rowsWithValue = rowsWithValue;
        this.missingTags = List.copyOf(missingTags);
    }

    public static StatementCoverage of(StatementCode statement, List<StatementRow> rows) {
        int withValue = 0;
        List<String> missing = new ArrayList<>();
        for (StatementRow row : rows) {
            if (row.hasValue()) {
                withValue++;
            } else {
                missing.add(row.getTag());
            }
        }
        return new StatementCoverage(statement, rows.size(), withValue, missing);
    }

    public StatementCode getStatement() {
        return statement;
    }

    public int getRowsTotal() {
        return rowsTotal;
    }

    public int getRowsWithValue() {
        return rowsWithValue;
    }

    public int getRowsMissingValues() {
        return rowsTotal - rowsWithValue;
    }

    /** Share of rows with a value; 0.0 for an empty statement. */
    public double getCoverageRatio() {
        return rowsTotal == 0 ? 0.0 : (double) rowsWithValue / rowsTotal;
    }

    /** Tags of rows without a value, in display order. */
    public List<String> getMissingTags() {
        return missingTags;
    }

    @Override
    public String toString() {
        return statement + " " + rowsWithValue + "/" + rowsTotal;
    }
}
