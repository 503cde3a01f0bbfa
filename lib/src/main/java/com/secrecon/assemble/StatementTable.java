package com.secrecon.assemble;

import com.secrecon.model.ResolvedContext;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import com.secrecon.resolve.ScopeOutcome;
import java.util.List;
import java.util.Objects;

/** A reconstructed statement: its rows in display order plus how its context was obtained. */
public final class StatementTable {
    private final String filingId;
    private final StatementCode statement;
    private final ResolvedContext context;
    private final ScopeOutcome scopeOutcome;
    private final boolean synthesized;
    private final List<StatementRow> rows;

    public StatementTable(
            String filingId,
            StatementCode statement,
            ResolvedContext context,
            ScopeOutcome scopeOutcome,
            boolean synthesized,
            List<StatementRow> rows) {
        this.filingId = Objects.requireNonNull(filingId, "filingId");
        this.statement = Objects.requireNonNull(statement, "statement");
        this.context = Objects.requireNonNull(context, "context");
        this.scopeOutcome = scopeOutcome;
        this.synthesized = synthesized;
        this.rows = List.copyOf(rows);
    }

    static StatementTable empty(String filingId, StatementCode statement) {
        return new StatementTable(filingId, statement, ResolvedContext.unknown(), ScopeOutcome.NO_MATCH, false, List.of());
    }

    public String getFilingId() {
        return filingId;
    }

    public StatementCode getStatement() {
        return statement;
    }

    /** Context the rows were resolved against; unknown when nothing could be inferred. */
    public ResolvedContext getContext() {
        return context;
    }

    /** Scope that produced the inferred context, or {@code null} when the caller pinned it fully. */
    public ScopeOutcome getScopeOutcome() {
        return scopeOutcome;
    }

    /** True when the rows were synthesized from facts because no presentation structure exists. */
    public boolean isSynthesized() {
        return synthesized;
    }

    public List<StatementRow> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
