package com.secrecon.resolve;

/** Which fact scope produced a context. */
public enum ScopeOutcome {
    /** Consolidated facts (no coreg, no segments) yielded a context. */
    PRIMARY_HIT,
    /** No consolidated fact qualified; the unrestricted fact set yielded a context. */
    FALLBACK_HIT,
    /** No fact qualified in either scope. */
    NO_MATCH
}
