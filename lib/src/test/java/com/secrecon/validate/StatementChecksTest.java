package com.secrecon.validate;

import static com.secrecon.testing.Fixtures.row;
import static com.secrecon.testing.Fixtures.valued;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import java.util.List;
import org.junit.jupiter.api.Test;

final class StatementChecksTest {

    private static StatementRow cash(int line, String tag, String value, String date, int quarters) {
        return valued(row(StatementCode.CF, line, tag, tag), value, date, quarters);
    }

    @Test
    void cashFlowToleratesOnePeriodAndTwoInstants() {
        List<StatementRow> rows =
                List.of(
                        cash(1, "NetCashProvidedByUsedInOperatingActivities", "90", "2024-09-30", 3),
                        cash(2, "CashAndCashEquivalentsAtCarryingValue", "400", "2023-12-31", 0),
                        cash(3, "CashAndCashEquivalentsAtCarryingValue", "500", "2024-09-30", 0));

        ContextCoherence coherence = ContextCoherence.check(StatementCode.CF, rows);

        assertTrue(coherence.isPassed());
        assertEquals(1, coherence.getPeriodContexts());
        assertEquals(2, coherence.getInstantContexts());
    }

    @Test
    void cashFlowWithThreeInstantsIsIncoherent() {
        List<StatementRow> rows =
                List.of(
                        cash(1, "NetCashProvidedByUsedInOperatingActivities", "90", "2024-09-30", 3),
                        cash(2, "CashAndCashEquivalentsAtCarryingValue", "300", "2022-12-31", 0),
                        cash(3, "CashAndCashEquivalentsAtCarryingValue", "400", "2023-12-31", 0),
                        cash(4, "CashAndCashEquivalentsAtCarryingValue", "500", "2024-09-30", 0));

        ContextCoherence coherence = ContextCoherence.check(StatementCode.CF, rows);

        assertFalse(coherence.isPassed());
        assertEquals(3, coherence.getInstantContexts());
    }

    @Test
    void otherStatementsAllowOneContextAndIgnoreMissingRows() {
        List<StatementRow> rows =
                List.of(
                        valued(row(StatementCode.IS, 1, "Revenues", "Revenues"), "10", "2024-09-30", 3),
                        valued(row(StatementCode.IS, 2, "CostOfRevenue", "Cost"), null, "2024-06-30", 1));

        assertTrue(ContextCoherence.check(StatementCode.IS, rows).isPassed());

        List<StatementRow> mixed =
                List.of(
                        valued(row(StatementCode.IS, 1, "Revenues", "Revenues"), "10", "2024-09-30", 3),
                        valued(row(StatementCode.IS, 2, "CostOfRevenue", "Cost"), "4", "2024-09-30", 1));

        ContextCoherence coherence = ContextCoherence.check(StatementCode.IS, mixed);
        assertFalse(coherence.isPassed());
        assertEquals(2, coherence.getContexts().size());
    }

    @Test
    void equityAcceptsAnyNumberOfContexts() {
        List<StatementRow> rows =
                List.of(
                        valued(row(StatementCode.EQ, 1, "StockholdersEquity", "Beginning balance"), "1", "2022-12-31", 0),
                        valued(row(StatementCode.EQ, 2, "NetIncomeLoss", "Net income"), "2", "2024-09-30", 3),
                        valued(row(StatementCode.EQ, 3, "DividendsCommonStock", "Dividends"), "3", "2024-09-30", 1),
                        valued(row(StatementCode.EQ, 4, "StockholdersEquity", "Ending balance"), "4", "2024-09-30", 0));

        assertTrue(ContextCoherence.check(StatementCode.EQ, rows).isPassed());
    }

    @Test
    void structuralParityComparesShape() {
        PresentationRow first = row(StatementCode.IS, 1, "Revenues", "Revenues");
        PresentationRow second = row(StatementCode.IS, 2, "NetIncomeLoss", "Net income");
        List<StatementRow> rows = List.of(valued(first, "1", "2024-09-30", 3), valued(second, null, null, null));

        StructuralParity parity = StructuralParity.check(List.of(first, second), rows);
        assertTrue(parity.isApplicable());
        assertTrue(parity.isPassed());
        assertEquals(-1, parity.getFirstMismatch());

        StructuralParity swapped = StructuralParity.check(List.of(second, first), rows);
        assertFalse(swapped.isPassed());
        assertEquals(0, swapped.getFirstMismatch());

        StructuralParity shorter = StructuralParity.check(List.of(first, second), rows.subList(0, 1));
        assertFalse(shorter.isPassed());
        assertEquals(1, shorter.getFirstMismatch());
        assertEquals(2, shorter.getExpectedRows());
        assertEquals(1, shorter.getActualRows());
    }

    @Test
    void structuralParityWithoutStructureIsNotApplicable() {
        StructuralParity parity =
                StructuralParity.check(
                        List.of(), List.of(valued(row(StatementCode.CI, 1, "ComprehensiveIncomeNetOfTax", "CI"), "1", "2024-09-30", 3)));

        assertFalse(parity.isApplicable());
        assertTrue(parity.isPassed());
    }

    @Test
    void candidateDiagnosticsSeparateDuplicatesFromConflicts() {
        List<StatementRow> rows =
                List.of(
                        valued(row(StatementCode.IS, 1, "Revenues", "Revenues"), "5100000", "2024-09-30", 4, 2, 2),
                        valued(row(StatementCode.IS, 2, "CostOfRevenue", "Cost"), "7", "2024-09-30", 4, 3, 1),
                        valued(row(StatementCode.IS, 3, "NetIncomeLoss", "Net income"), "1", "2024-09-30", 4));

        CandidateDiagnostics diagnostics = CandidateDiagnostics.of(rows);

        assertEquals(2, diagnostics.getDuplicateCount());
        assertEquals(1, diagnostics.getConflictCount());
        RowReference conflict = diagnostics.getConflictRows().get(0);
        assertEquals("Revenues", conflict.getTag());
        assertEquals(2, conflict.getCandidateCount());
        assertEquals(2, conflict.getCandidateUniqueValues());
    }

    @Test
    void missingValuesAreClassified() {
        List<StatementRow> rows =
                List.of(
                        valued(row(StatementCode.BS, 1, "AssetsAbstract", "Assets"), null, null, null),
                        valued(row(StatementCode.BS, 2, "Goodwill", "Goodwill"), null, null, null),
                        valued(row(StatementCode.BS, 3, "CommitmentsAndContingencies", "Commitments"), null, null, null),
                        valued(row(StatementCode.BS, 4, "Assets", "Total assets"), "1", "2024-09-30", 0));

        MissingValues missing = MissingValues.classify(rows);

        assertEquals(2, missing.getExpected().size());
        assertEquals(1, missing.getUnexpected().size());
        assertEquals("Goodwill", missing.getUnexpected().get(0).getTag());
        assertTrue(MissingValues.isExpectedMissing("AccountingPoliciesTextBlock"));
        assertFalse(MissingValues.isExpectedMissing("Liabilities"));
    }
}
