package com.secrecon.validate;

import com.secrecon.model.StatementRow;
import java.util.ArrayList;
import java.util.List;

/** Rows whose selector saw more than one candidate, and the subset whose candidates disagreed. */
public final class CandidateDiagnostics {
    private final List<RowReference> duplicateRows;
    private final List<RowReference> conflictRows;

    public CandidateDiagnostics(List<RowReference> duplicateRows, List<RowReference> conflictRows) {
        this.duplicateRows = List.copyOf(duplicateRows);
        this.conflictRows = List.copyOf(conflictRows);
    }

    public static CandidateDiagnostics of(List<StatementRow> rows) {
        List<RowReference> duplicates = new ArrayList<>();
        List<RowReference> conflicts = new ArrayList<>();
        for (StatementRow row : rows) {
            if (row.getCandidateCount() > 1) {
                duplicates.add(RowReference.of(row));
            }
            if (row.isConflict()) {
                conflicts.add(RowReference.of(row));
            }
        }
        return new CandidateDiagnostics(duplicates, conflicts);
    }

    public List<RowReference> getDuplicateRows() {
        return duplicateRows;
    }

    public List<RowReference> getConflictRows() {
        return conflictRows;
    }

    public int getDuplicateCount() {
        return duplicateRows.size();
    }

    public int getConflictCount() {
        return conflictRows.size();
    }
}
