package com.secrecon.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * The (end date, duration) pair anchoring value lookup for one statement. Either half may be
 * unknown; a fully unknown context is a normal outcome, not an error.
 */
public final class ResolvedContext {

    private static final ResolvedContext UNKNOWN = new ResolvedContext(null, null);

    private final LocalDate endDate;
    private final Integer duration;

    private ResolvedContext(LocalDate endDate, Integer duration) {
        this.endDate = endDate;
        this.duration = duration;
    }

    public static ResolvedContext of(LocalDate endDate, Integer duration) {
        if (endDate == null && duration == null) {
            return UNKNOWN;
        }
        return new ResolvedContext(endDate, duration);
    }

    public static ResolvedContext unknown() {
        return UNKNOWN;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public Integer getDuration() {
        return duration;
    }

    public boolean isKnown() {
        return endDate != null || duration != null;
    }

    /** Keeps the pinned halves of this context and fills the missing ones from {@code inferred}. */
    public ResolvedContext fillFrom(ResolvedContext inferred) {
        return of(
                endDate != null ? endDate : inferred.endDate,
                duration != null ? duration : inferred.duration);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedContext)) {
            return false;
        }
        ResolvedContext other = (ResolvedContext) o;
        return Objects.equals(endDate, other.endDate) && Objects.equals(duration, other.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endDate, duration);
    }

    @Override
    public String toString() {
        return "(" + endDate + ", " + duration + ")";
    }
}
