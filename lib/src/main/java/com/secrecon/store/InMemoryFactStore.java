package com.secrecon.store;

import com.secrecon.model.NumericFact;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** {@link FactStore} over an immutable snapshot of facts, grouped by filing in insertion order. */
public final class InMemoryFactStore implements FactStore {

    private final Map<String, List<NumericFact>> factsByFiling;
    private final int size;

    public InMemoryFactStore(Collection<NumericFact> facts) {
        Objects.requireNonNull(facts, "facts");
        Map<String, List<NumericFact>> grouped = new LinkedHashMap<>();
        for (NumericFact fact : facts) {
            grouped.computeIfAbsent(fact.getFilingId(), id -> new ArrayList<>()).add(fact);
        }
        Map<String, List<NumericFact>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, List<NumericFact>> entry : grouped.entrySet()) {
            frozen.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.factsByFiling = Collections.unmodifiableMap(frozen);
        this.size = facts.size();
    }

    @Override
    public List<NumericFact> factsFor(String filingId) {
        Objects.requireNonNull(filingId, "filingId");
        return factsByFiling.getOrDefault(filingId, List.of());
    }

    public Set<String> filingIds() {
        return factsByFiling.keySet();
    }

    /** Every fact in the store, filing by filing. */
    public List<NumericFact> allFacts() {
        List<NumericFact> all = new ArrayList<>(size);
        for (List<NumericFact> facts : factsByFiling.values()) {
            all.addAll(facts);
        }
        return all;
    }

    public int size() {
        return size;
    }
}
