package com.secrecon.select;

import com.secrecon.model.NumericFact;
import com.secrecon.model.PresentationRow;
import com.secrecon.model.ResolvedContext;
import com.secrecon.model.StatementCode;
import com.secrecon.semantic.ConceptRole;
import com.secrecon.semantic.SemanticRules;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Picks at most one fact for a presentation row.
 *
 * <p>Candidates are narrowed step by step: tag and version, the row's desired duration, the
 * row's date mode, the forced boundary date of cash and equity roll-forward rows, then the
 * consolidated-entity and consolidated-total preferences. A narrowing step that would leave no
 * candidate is skipped. The survivors are ranked and the first one wins.</p>
 */
public final class FactSelector {

    private static final Comparator<NumericFact> BY_ABSOLUTE_VALUE_DESC =
            Comparator.comparing((NumericFact fact) -> fact.getValue().abs()).reversed();
    private static final Comparator<NumericFact> BY_DATE_DESC =
            Comparator.comparing(NumericFact::getEndDate).reversed();

    private enum DateMode {
        BEFORE,
        EQUAL
    }

    /**
     * Selects the fact for one row.
     *
     * @param row the presentation row; its tag, version, statement and label drive the narrowing
     * @param target resolved or pinned statement context; either half may be unknown
     * @param datePinned whether the caller pinned the end date for the whole statement
     * @param facts facts of the filing, or any superset of the row's tag facts
     */
    public FactSelection select(
            PresentationRow row, ResolvedContext target, boolean datePinned, List<NumericFact> facts) {
        Objects.requireNonNull(row, "row");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(facts, "facts");
        StatementCode statement = row.getStatement();

        List<NumericFact> candidates = matching(row.getTag(), row.getVersion(), facts);
        if (candidates.isEmpty()) {
            return FactSelection.none();
        }

        Optional<ConceptRole> role = SemanticRules.labelRole(row.getLabel());
        boolean boundaryRow = isBoundaryRow(statement, row.getTag(), role);

        Integer desiredDuration = desiredDuration(statement, row.getTag(), role, target.getDuration());
        if (desiredDuration != null) {
            candidates = narrow(candidates, fact -> desiredDuration.equals(fact.getDuration()));
        }

        LocalDate targetDate = target.getEndDate();
        DateMode mode = role.orElse(null) == ConceptRole.BEGINNING_BALANCE ? DateMode.BEFORE : DateMode.EQUAL;
        if (targetDate != null) {
            candidates =
                    mode == DateMode.BEFORE
                            ? narrow(candidates, fact -> fact.getEndDate().isBefore(targetDate))
                            : narrow(candidates, fact -> fact.getEndDate().equals(targetDate));
        }

        if (boundaryRow) {
            candidates = forceBoundary(candidates, statement, role.get(), targetDate, datePinned);
        }

        boolean segmentPreference = !statement.isEquity();
        candidates = narrow(candidates, fact -> !fact.hasCoreg());
        if (segmentPreference) {
            candidates = narrow(candidates, fact -> !fact.hasSegments());
        }

        return rank(candidates, segmentPreference);
    }

    /**
     * Ranks a group of facts with no row semantics: consolidated entity first, consolidated total
     * first, larger absolute value first, later date first.
     */
    public FactSelection selectPreferred(List<NumericFact> group) {
        Objects.requireNonNull(group, "group");
        List<NumericFact> candidates = new ArrayList<>();
        for (NumericFact fact : group) {
            if (isCandidate(fact)) {
                candidates.add(fact);
            }
        }
        return rank(candidates, true);
    }

    static boolean isCandidate(NumericFact fact) {
        return fact.getValue() != null && fact.getEndDate() != null;
    }

    private static List<NumericFact> matching(String tag, String version, List<NumericFact> facts) {
        List<NumericFact> matches = new ArrayList<>();
        for (NumericFact fact : facts) {
            if (!tag.equals(fact.getTag())) {
                continue;
            }
            if (version != null && !version.equals(fact.getVersion())) {
                continue;
            }
            if (isCandidate(fact)) {
                matches.add(fact);
            }
        }
        return matches;
    }

    private static boolean isBoundaryRow(StatementCode statement, String tag, Optional<ConceptRole> role) {
        if (role.isEmpty() || !role.get().isBoundary()) {
            return false;
        }
        if (statement.isCashFlow()) {
            return SemanticRules.isCashBalanceConcept(tag);
        }
        return statement.isEquity();
    }

    private static Integer desiredDuration(
            StatementCode statement, String tag, Optional<ConceptRole> role, Integer statementDuration) {
        if (statement.isBalanceSheet()) {
            return 0;
        }
        if (statement.isCashFlow()
                && SemanticRules.isCashBalanceConcept(tag)
                && role.isPresent()
                && role.get().isBoundary()) {
            return 0;
        }
        if (statement.isEquity() && role.isPresent() && role.get().isBalance()) {
            return 0;
        }
        return statementDuration;
    }

    private static List<NumericFact> forceBoundary(
            List<NumericFact> candidates,
            StatementCode statement,
            ConceptRole role,
            LocalDate targetDate,
            boolean datePinned) {
        LocalDate boundary;
        if (statement.isEquity() && !datePinned) {
            boundary = role == ConceptRole.BEGINNING_BALANCE ? earliest(candidates) : latest(candidates);
        } else if (targetDate == null) {
            return candidates;
        } else if (role == ConceptRole.BEGINNING_BALANCE) {
            boundary = latestBefore(candidates, targetDate);
        } else {
            boundary = targetDate;
        }
        if (boundary == null) {
            return candidates;
        }
        LocalDate chosenDate = boundary;
        return narrow(candidates, fact -> fact.getEndDate().equals(chosenDate));
    }

    private static LocalDate earliest(List<NumericFact> facts) {
        LocalDate earliest = null;
        for (NumericFact fact : facts) {
            if (earliest == null || fact.getEndDate().isBefore(earliest)) {
                earliest = fact.getEndDate();
            }
        }
        return earliest;
    }

    private static LocalDate latest(List<NumericFact> facts) {
        LocalDate latest = null;
        for (NumericFact fact : facts) {
            if (latest == null || fact.getEndDate().isAfter(latest)) {
                latest = fact.getEndDate();
            }
        }
        return latest;
    }

    private static LocalDate latestBefore(List<NumericFact> facts, LocalDate target) {
        LocalDate latest = null;
        for (NumericFact fact : facts) {
            LocalDate date = fact.getEndDate();
            if (date.isBefore(target) && (latest == null || date.isAfter(latest))) {
                latest = date;
            }
        }
        return latest;
    }

    /** Applies a filter only when it keeps at least one candidate. */
    private static List<NumericFact> narrow(List<NumericFact> candidates, Predicate<NumericFact> predicate) {
        List<NumericFact> kept = new ArrayList<>();
        for (NumericFact fact : candidates) {
            if (predicate.test(fact)) {
                kept.add(fact);
            }
        }
        return kept.isEmpty() ? candidates : kept;
    }

    private static FactSelection rank(List<NumericFact> candidates, boolean segmentPreference) {
        if (candidates.isEmpty()) {
            return FactSelection.none();
        }
        Comparator<NumericFact> order = Comparator.comparing(NumericFact::hasCoreg);
        if (segmentPreference) {
            order = order.thenComparing(NumericFact::hasSegments);
        }
        order = order.thenComparing(BY_ABSOLUTE_VALUE_DESC).thenComparing(BY_DATE_DESC);
        // List.sort is stable, so equal-rank facts keep store order
        List<NumericFact> ranked = new ArrayList<>(candidates);
        ranked.sort(order);
        return new FactSelection(ranked.get(0), candidates.size(), distinctValues(candidates));
    }

    private static int distinctValues(List<NumericFact> facts) {
        Set<BigDecimal> values = new HashSet<>();
        for (NumericFact fact : facts) {
            values.add(fact.getValue().stripTrailingZeros());
        }
        return values.size();
    }
}
