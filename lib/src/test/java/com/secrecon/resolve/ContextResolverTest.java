package com.secrecon.resolve;

import static com.secrecon.testing.Fixtures.fact;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.secrecon.model.NumericFact;
import com.secrecon.model.ResolvedContext;
import com.secrecon.model.StatementCode;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ContextResolverTest {

    private final ContextResolver resolver = new ContextResolver();

    @Test
    void balanceSheetUsesLatestInstant() {
        List<NumericFact> facts =
                List.of(
                        fact("Assets", "2023-12-31", 0, "700"),
                        fact("Assets", "2024-09-30", 0, "800"),
                        fact("Revenues", "2024-12-31", 1, "50"));

        ContextResolution resolution = resolver.resolve(StatementCode.BS, Set.of("Assets"), facts);

        assertEquals(ResolvedContext.of(LocalDate.of(2024, 9, 30), 0), resolution.getContext());
        assertEquals(ScopeOutcome.PRIMARY_HIT, resolution.getOutcome());
    }

    @Test
    void periodStatementsIgnoreInstantsAndTakeModeDuration() {
        List<NumericFact> facts =
                List.of(
                        fact("Revenues", "2024-09-30", 3, "300"),
                        fact("Revenues", "2024-09-30", 1, "100"),
                        fact("NetIncomeLoss", "2024-09-30", 1, "10"),
                        fact("NetIncomeLoss", "2024-09-30", 3, "30"),
                        fact("CostOfRevenue", "2024-09-30", 1, "60"),
                        fact("Revenues", "2024-10-31", 0, "999"));

        ContextResolution resolution =
                resolver.resolve(StatementCode.IS, Set.of("Revenues", "NetIncomeLoss", "CostOfRevenue"), facts);

        assertEquals(ResolvedContext.of(LocalDate.of(2024, 9, 30), 1), resolution.getContext());
    }

    @Test
    void durationModeTiesGoToFirstEncountered() {
        List<NumericFact> facts =
                List.of(
                        fact("Revenues", "2024-09-30", 3, "300"),
                        fact("Revenues", "2024-09-30", 1, "100"),
                        fact("NetIncomeLoss", "2024-09-30", 1, "10"),
                        fact("NetIncomeLoss", "2024-09-30", 3, "30"));

        ResolvedContext context =
                resolver.resolve(StatementCode.IS, Set.of("Revenues", "NetIncomeLoss"), facts).getContext();

        assertEquals(Integer.valueOf(3), context.getDuration());
    }

    @Test
    void fallsBackToQualifiedFactsOnlyWhenPrimaryScopeIsEmpty() {
        List<NumericFact> facts =
                List.of(
                        fact("Revenues", "2024-06-30", 2, "1", null, "Segment=A;"),
                        fact("Revenues", "2024-09-30", 3, "2", "SubsidiaryMember", null),
                        fact("Assets", "2024-12-31", 0, "5"));

        ContextResolution resolution = resolver.resolve(StatementCode.IS, Set.of("Revenues"), facts);

        assertEquals(ScopeOutcome.FALLBACK_HIT, resolution.getOutcome());
        assertEquals(ResolvedContext.of(LocalDate.of(2024, 9, 30), 3), resolution.getContext());
    }

    @Test
    void primaryScopeWinsEvenWithOlderContext() {
        List<NumericFact> facts =
                List.of(
                        fact("Revenues", "2024-06-30", 2, "1"),
                        fact("Revenues", "2024-09-30", 3, "2", "SubsidiaryMember", null));

        ContextResolution resolution = resolver.resolve(StatementCode.IS, Set.of("Revenues"), facts);

        assertEquals(ScopeOutcome.PRIMARY_HIT, resolution.getOutcome());
        assertEquals(LocalDate.of(2024, 6, 30), resolution.getContext().getEndDate());
    }

    @Test
    void noQualifyingFactIsUnknownContext() {
        List<NumericFact> facts =
                List.of(fact("Revenues", "2024-09-30", 0, "1"), fact("Revenues", null, 1, "2"), fact("Other", "2024-09-30", 1, "3"));

        ContextResolution resolution = resolver.resolve(StatementCode.IS, Set.of("Revenues"), facts);

        assertEquals(ScopeOutcome.NO_MATCH, resolution.getOutcome());
        assertFalse(resolution.getContext().isKnown());
        assertEquals(0, resolution.getQualifyingFacts());
    }
}
