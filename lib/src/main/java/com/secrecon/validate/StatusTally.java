package com.secrecon.validate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Count of filings per status. Merging is commutative, so partial tallies combine in any order. */
public final class StatusTally {
    private final EnumMap<ValidationStatus, Integer> counts;

    private StatusTally(EnumMap<ValidationStatus, Integer> counts) {
        this.counts = counts;
    }

    public static StatusTally empty() {
        EnumMap<ValidationStatus, Integer> counts = new EnumMap<>(ValidationStatus.class);
        for (ValidationStatus status : ValidationStatus.values()) {
            counts.put(status, 0);
        }
        return new StatusTally(counts);
    }

    public static StatusTally of(ValidationStatus status) {
        return empty().plus(status);
    }

    public StatusTally plus(ValidationStatus status) {
        EnumMap<ValidationStatus, Integer> next = new EnumMap<>(counts);
        next.merge(status, 1, Integer::sum);
        return new StatusTally(next);
    }

    public StatusTally merge(StatusTally other) {
        EnumMap<ValidationStatus, Integer> next = new EnumMap<>(counts);
        other.counts.forEach((status, count) -> next.merge(status, count, Integer::sum));
        return new StatusTally(next);
    }

    public int count(ValidationStatus status) {
        return counts.get(status);
    }

    public int total() {
        int total = 0;
        for (int count : counts.values()) {
            total += count;
        }
        return total;
    }

    /** Every status with its count, zero counts included. */
    public Map<ValidationStatus, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StatusTally && counts.equals(((StatusTally) o).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "pass=" + count(ValidationStatus.PASS) + " warn=" + count(ValidationStatus.WARN) + " fail="
                + count(ValidationStatus.FAIL);
    }
}
