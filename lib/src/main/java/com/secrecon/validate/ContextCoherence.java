package com.secrecon.validate;

import com.secrecon.model.ResolvedContext;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Counts the distinct (date, duration) contexts among valued rows. Cash-flow statements tolerate
 * one period plus two instants, equity statements any number, all others one.
 */
public final class ContextCoherence {
    static final int CASH_FLOW_MAX_PERIODS = 1;
    static final int CASH_FLOW_MAX_INSTANTS = 2;

    private final boolean passed;
    private final List<ResolvedContext> contexts;
    private final int periodContexts;
    private final int instantContexts;

    private ContextCoherence(boolean passed, List<ResolvedContext> contexts, int periodContexts, int instantContexts) {
        this.passed = passed;
        this.contexts = List.copyOf(contexts);
        this.periodContexts = periodContexts;
        this.instantContexts = instantContexts;
    }

    public static ContextCoherence check(StatementCode statement, List<StatementRow> rows) {
        Set<ResolvedContext> distinct = new LinkedHashSet<>();
        for (StatementRow row : rows) {
            if (row.hasValue()) {
                distinct.add(row.getContext());
            }
        }
        int instants = 0;
        int periods = 0;
        for (ResolvedContext context : distinct) {
            if (context.getDuration() != null && context.getDuration() == 0) {
                instants++;
            } else {
                periods++;
            }
        }
        boolean passed;
        if (statement.isEquity()) {
            passed = true;
        } else if (statement.isCashFlow()) {
            passed = periods <= CASH_FLOW_MAX_PERIODS && instants <= CASH_FLOW_MAX_INSTANTS;
        } else {
            passed = distinct.size() <= 1;
        }
        return new ContextCoherence(passed, new ArrayList<>(distinct), periods, instants);
    }

    public boolean isPassed() {
        return passed;
    }

    /** Distinct contexts among valued rows, in first-seen order. */
    public List<ResolvedContext> getContexts() {
        return contexts;
    }

    public int getPeriodContexts() {
        return periodContexts;
    }

    public int getInstantContexts() {
        return instantContexts;
    }
}
