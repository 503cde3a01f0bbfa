package com.secrecon.store;

import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementCode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** {@link PresentationStore} over an immutable snapshot of presentation rows. */
public final class InMemoryPresentationStore implements PresentationStore {

    private final Map<String, Map<StatementCode, List<PresentationRow>>> rowsByFiling;
    private final int size;

    public InMemoryPresentationStore(Collection<PresentationRow> rows) {
        Objects.requireNonNull(rows, "rows");
        Map<String, Map<StatementCode, List<PresentationRow>>> grouped = new LinkedHashMap<>();
        for (PresentationRow row : rows) {
            grouped.computeIfAbsent(row.getFilingId(), id -> new LinkedHashMap<>())
                    .computeIfAbsent(row.getStatement(), code -> new ArrayList<>())
                    .add(row);
        }
        Map<String, Map<StatementCode, List<PresentationRow>>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, Map<StatementCode, List<PresentationRow>>> filing : grouped.entrySet()) {
            Map<StatementCode, List<PresentationRow>> statements = new LinkedHashMap<>();
            for (Map.Entry<StatementCode, List<PresentationRow>> entry : filing.getValue().entrySet()) {
                statements.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
            frozen.put(filing.getKey(), Collections.unmodifiableMap(statements));
        }
        this.rowsByFiling = Collections.unmodifiableMap(frozen);
        this.size = rows.size();
    }

    @Override
    public List<PresentationRow> structureFor(String filingId, StatementCode statement) {
        Objects.requireNonNull(filingId, "filingId");
        Objects.requireNonNull(statement, "statement");
        Map<StatementCode, List<PresentationRow>> statements = rowsByFiling.get(filingId);
        if (statements == null) {
            return List.of();
        }
        return statements.getOrDefault(statement, List.of());
    }

    public Set<String> filingIds() {
        return rowsByFiling.keySet();
    }

    /** Statement codes that have at least one presentation row for the filing. */
    public Set<StatementCode> statementsFor(String filingId) {
        Map<StatementCode, List<PresentationRow>> statements = rowsByFiling.get(filingId);
        return statements == null ? Set.of() : statements.keySet();
    }

    public List<PresentationRow> allRows() {
        List<PresentationRow> all = new ArrayList<>(size);
        for (Map<StatementCode, List<PresentationRow>> statements : rowsByFiling.values()) {
            for (List<PresentationRow> rows : statements.values()) {
                all.addAll(rows);
            }
        }
        return all;
    }

    public int size() {
        return size;
    }
}
