package com.secrecon.resolve;

import com.secrecon.model.NumericFact;
import com.secrecon.model.ResolvedContext;
import com.secrecon.model.StatementCode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Infers the (end date, duration) anchoring a statement when the caller does not pin one.
 *
 * <p>Facts are restricted to the statement's tags and to the statement family's duration rule
 * (instants for balance sheets, true periods otherwise). Consolidated facts are tried first; the
 * unrestricted set is used only when that scope yields nothing. The latest end date wins and the
 * most frequent duration at that date, first encountered on ties, becomes the representative
 * duration.</p>
 */
public final class ContextResolver {

    public ContextResolution resolve(StatementCode statement, Collection<String> tags, List<NumericFact> facts) {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(tags, "tags");
        Objects.requireNonNull(facts, "facts");
        Set<String> tagSet = new HashSet<>(tags);
        Predicate<NumericFact> qualifies =
                fact -> tagSet.contains(fact.getTag()) && matchesDurationRule(statement, fact);
        return resolveInScopes(facts, qualifies);
    }

    /**
     * Latest duration context over all of a filing's facts, regardless of statement. Used to label
     * the filing's reporting period.
     */
    public ContextResolution latestPeriod(List<NumericFact> facts) {
        Objects.requireNonNull(facts, "facts");
        return resolveInScopes(facts, NumericFact::isPeriod);
    }

    private static boolean matchesDurationRule(StatementCode statement, NumericFact fact) {
        if (statement.isBalanceSheet()) {
            return fact.isInstant();
        }
        return fact.isPeriod();
    }

    private static ContextResolution resolveInScopes(List<NumericFact> facts, Predicate<NumericFact> qualifies) {
        List<NumericFact> primary = filter(facts, qualifies.and(NumericFact::isPrimary));
        if (!primary.isEmpty()) {
            return new ContextResolution(anchor(primary), ScopeOutcome.PRIMARY_HIT, primary.size());
        }
        List<NumericFact> all = filter(facts, qualifies);
        if (!all.isEmpty()) {
            return new ContextResolution(anchor(all), ScopeOutcome.FALLBACK_HIT, all.size());
        }
        return ContextResolution.noMatch();
    }

    private static List<NumericFact> filter(List<NumericFact> facts, Predicate<NumericFact> predicate) {
        List<NumericFact> kept = new ArrayList<>();
        for (NumericFact fact : facts) {
            // an unparseable date cannot anchor anything
            if (fact.getEndDate() != null && predicate.test(fact)) {
                kept.add(fact);
            }
        }
        return kept;
    }

    private static ResolvedContext anchor(List<NumericFact> candidates) {
        LocalDate latest = null;
        for (NumericFact fact : candidates) {
            if (latest == null || fact.getEndDate().isAfter(latest)) {
                latest = fact.getEndDate();
            }
        }
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (NumericFact fact : candidates) {
            if (fact.getEndDate().equals(latest) && fact.getDuration() != null) {
                counts.merge(fact.getDuration(), 1, Integer::sum);
            }
        }
        Integer mode = null;
        int best = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mode = entry.getKey();
            }
        }
        return ResolvedContext.of(latest, mode);
    }
}
