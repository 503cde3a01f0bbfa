package com.secrecon.resolve;

import com.secrecon.model.ResolvedContext;
import java.util.Objects;

/** Result of context inference: the context and the scope it was taken from. */
public final class ContextResolution {

    private static final ContextResolution NO_MATCH =
            new ContextResolution(ResolvedContext.unknown(), ScopeOutcome.NO_MATCH, 0);

    private final ResolvedContext context;
    private final ScopeOutcome outcome;
    private final int qualifyingFacts;

    ContextResolution(ResolvedContext context, ScopeOutcome outcome, int qualifyingFacts) {
        this.context = Objects.requireNonNull(context, "context");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.qualifyingFacts = qualifyingFacts;
    }

    static ContextResolution noMatch() {
        return NO_MATCH;
    }

    public ResolvedContext getContext() {
        return context;
    }

    public ScopeOutcome getOutcome() {
        return outcome;
    }

    /** Number of facts that passed the scope and duration filters. */
    public int getQualifyingFacts() {
        return qualifyingFacts;
    }

    @Override
    public String toString() {
        return outcome + " " + context;
    }
}
