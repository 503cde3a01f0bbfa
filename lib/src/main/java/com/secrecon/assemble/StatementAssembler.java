package com.secrecon.assemble;

import com.secrecon.model.NumericFact;
import com.secrecon.model.PresentationRow;
import com.secrecon.model.ResolvedContext;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import com.secrecon.resolve.ContextResolution;
import com.secrecon.resolve.ContextResolver;
import com.secrecon.resolve.ScopeOutcome;
import com.secrecon.select.FactSelection;
import com.secrecon.select.FactSelector;
import com.secrecon.sign.SignNormalizer;
import com.secrecon.sign.ValueFormatter;
import com.secrecon.store.FactStore;
import com.secrecon.store.LabelLookup;
import com.secrecon.store.PresentationStore;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds one statement table per (filing, statement). Every presentation row yields exactly one
 * output row, in (report, line) order. A comprehensive-income statement without presentation rows
 * is synthesized from its facts instead.
 */
public final class StatementAssembler {
    private static final Logger LOGGER = Logger.getLogger(StatementAssembler.class.getName());

    static final String COMPREHENSIVE_INCOME_MARKER = "comprehensiveincome";
    static final String SYNTHETIC_SOURCE_FILE = "D";

    private final FactStore facts;
    private final PresentationStore presentation;
    private final LabelLookup labels;
    private final ContextResolver resolver = new ContextResolver();
    private final FactSelector selector = new FactSelector();

    public StatementAssembler(FactStore facts, PresentationStore presentation, LabelLookup labels) {
        this.facts = Objects.requireNonNull(facts, "facts");
        this.presentation = Objects.requireNonNull(presentation, "presentation");
        this.labels = labels == null ? LabelLookup.NONE : labels;
    }

    /**
     * Reconstructs one statement.
     *
     * @param endDate pinned end date, or {@code null} to infer it
     * @param duration pinned duration in quarters, or {@code null} to infer it
     */
    public StatementTable assemble(String filingId, StatementCode statement, LocalDate endDate, Integer duration) {
        Objects.requireNonNull(filingId, "filingId");
        Objects.requireNonNull(statement, "statement");
        List<PresentationRow> structure = sortedStructure(filingId, statement);
        List<NumericFact> filingFacts = facts.factsFor(filingId);
        if (structure.isEmpty()) {
            if (statement.isComprehensiveIncome()) {
                return synthesizeComprehensiveIncome(filingId, statement, filingFacts, endDate, duration);
            }
            LOGGER.log(Level.FINE, "{0} {1}: no presentation structure", new Object[] {filingId, statement});
            return StatementTable.empty(filingId, statement);
        }

        Set<String> tags = new LinkedHashSet<>();
        for (PresentationRow row : structure) {
            tags.add(row.getTag());
        }
        ResolvedContext pinned = ResolvedContext.of(endDate, duration);
        ResolvedContext target = pinned;
        ScopeOutcome outcome = null;
        if (endDate == null || duration == null) {
            ContextResolution resolution = resolver.resolve(statement, tags, filingFacts);
            target = pinned.fillFrom(resolution.getContext());
            outcome = resolution.getOutcome();
        }

        Map<String, List<NumericFact>> factsByTag = indexByTag(filingFacts, tags);
        List<StatementRow> rows = new ArrayList<>(structure.size());
        for (PresentationRow row : structure) {
            FactSelection selection =
                    selector.select(row, target, endDate != null, factsByTag.getOrDefault(row.getTag(), List.of()));
            rows.add(toStatementRow(row, selection, target));
        }
        LOGGER.log(
                Level.FINE,
                "{0} {1}: {2} rows at {3} ({4})",
                new Object[] {filingId, statement, rows.size(), target, outcome});
        return new StatementTable(filingId, statement, target, outcome, false, rows);
    }

    /** Presentation rows of one statement in display order. */
    public List<PresentationRow> sortedStructure(String filingId, StatementCode statement) {
        List<PresentationRow> structure = new ArrayList<>(presentation.structureFor(filingId, statement));
        structure.sort(PresentationRow.DISPLAY_ORDER);
        return structure;
    }

    private StatementTable synthesizeComprehensiveIncome(
            String filingId,
            StatementCode statement,
            List<NumericFact> filingFacts,
            LocalDate endDate,
            Integer duration) {
        List<NumericFact> pool = new ArrayList<>();
        for (NumericFact fact : filingFacts) {
            if (fact.getTag().toLowerCase(Locale.ROOT).contains(COMPREHENSIVE_INCOME_MARKER)
                    && fact.isPeriod()
                    && fact.getValue() != null
                    && fact.getEndDate() != null
                    && (endDate == null || endDate.equals(fact.getEndDate()))
                    && (duration == null || duration.equals(fact.getDuration()))) {
                pool.add(fact);
            }
        }
        if (pool.isEmpty()) {
            LOGGER.log(Level.FINE, "{0} {1}: no comprehensive income facts", new Object[] {filingId, statement});
            return StatementTable.empty(filingId, statement);
        }
        if (endDate == null || duration == null) {
            pool = latestContext(pool, duration == null);
        }

        Map<String, List<NumericFact>> groups = new TreeMap<>();
        for (NumericFact fact : pool) {
            groups.computeIfAbsent(fact.getTag(), tag -> new ArrayList<>()).add(fact);
        }
        List<StatementRow> rows = new ArrayList<>(groups.size());
        ResolvedContext context = ResolvedContext.unknown();
        int line = 1;
        for (Map.Entry<String, List<NumericFact>> group : groups.entrySet()) {
            FactSelection selection = selector.selectPreferred(group.getValue());
            NumericFact chosen = selection.getChosen().orElseThrow();
            String tag = group.getKey();
            PresentationRow synthetic =
                    new PresentationRow(
                            filingId,
                            statement,
                            0,
                            line++,
                            0,
                            SYNTHETIC_SOURCE_FILE,
                            tag,
                            chosen.getVersion(),
                            labels.labelFor(tag).orElse(tag),
                            false);
            rows.add(toStatementRow(synthetic, selection, ResolvedContext.unknown()));
            if (!context.isKnown()) {
                context = ResolvedContext.of(chosen.getEndDate(), chosen.getDuration());
            }
        }
        LOGGER.log(
                Level.FINE,
                "{0} {1}: synthesized {2} rows from facts",
                new Object[] {filingId, statement, rows.size()});
        return new StatementTable(filingId, statement, context, null, true, rows);
    }

    /** Keeps facts at the latest end date and, when asked, at the most frequent duration there. */
    private static List<NumericFact> latestContext(List<NumericFact> pool, boolean narrowDuration) {
        LocalDate latest = null;
        for (NumericFact fact : pool) {
            if (latest == null || fact.getEndDate().isAfter(latest)) {
                latest = fact.getEndDate();
            }
        }
        List<NumericFact> atLatest = new ArrayList<>();
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (NumericFact fact : pool) {
            if (fact.getEndDate().equals(latest)) {
                atLatest.add(fact);
                counts.merge(fact.getDuration(), 1, Integer::sum);
            }
        }
        if (!narrowDuration) {
            return atLatest;
        }
        Integer mode = null;
        int best = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mode = entry.getKey();
            }
        }
        List<NumericFact> atMode = new ArrayList<>();
        for (NumericFact fact : atLatest) {
            if (fact.getDuration().equals(mode)) {
                atMode.add(fact);
            }
        }
        return atMode;
    }

    private static Map<String, List<NumericFact>> indexByTag(List<NumericFact> filingFacts, Set<String> tags) {
        Map<String, List<NumericFact>> index = new LinkedHashMap<>();
        for (NumericFact fact : filingFacts) {
            if (tags.contains(fact.getTag())) {
                index.computeIfAbsent(fact.getTag(), tag -> new ArrayList<>()).add(fact);
            }
        }
        return index;
    }

    private static StatementRow toStatementRow(PresentationRow row, FactSelection selection, ResolvedContext target) {
        if (selection.getChosen().isEmpty()) {
            return new StatementRow(
                    row,
                    null,
                    null,
                    null,
                    null,
                    target.getEndDate(),
                    target.getDuration(),
                    null,
                    null,
                    selection.getCandidateCount(),
                    selection.getUniqueValues());
        }
        NumericFact chosen = selection.getChosen().get();
        BigDecimal display =
                SignNormalizer.normalize(row.getStatement(), row.getTag(), chosen.getValue(), row.isNegating());
        return new StatementRow(
                row,
                chosen.getValue(),
                display,
                ValueFormatter.format(display),
                chosen.getUnit(),
                chosen.getEndDate(),
                chosen.getDuration(),
                chosen.getSegments(),
                chosen.getCoreg(),
                selection.getCandidateCount(),
                selection.getUniqueValues());
    }
}
