package com.secrecon.engine;

import static com.secrecon.testing.TestResources.FILING_A;
import static com.secrecon.testing.TestResources.FILING_B;
import static com.secrecon.testing.TestResources.FILING_C;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.secrecon.assemble.StatementCoverage;
import com.secrecon.assemble.StatementTable;
import com.secrecon.loader.DatasetLoader;
import com.secrecon.model.ResolvedContext;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import com.secrecon.testing.TestResources;
import com.secrecon.validate.BatchValidationReport;
import com.secrecon.validate.FilingSummary;
import com.secrecon.validate.FilingValidationReport;
import com.secrecon.validate.RowReference;
import com.secrecon.validate.StatementDiagnostics;
import com.secrecon.validate.SubtotalCheck;
import com.secrecon.validate.ValidationStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class StatementEngineTest {

    private static StatementEngine engine() throws Exception {
        return engine(EngineOptions.defaults());
    }

    private static StatementEngine engine(EngineOptions options) throws Exception {
        return StatementEngine.over(new DatasetLoader().load(TestResources.datasetDir()).getDataset(), options);
    }

    private static List<String> formatted(List<StatementRow> rows) {
        List<String> values = new ArrayList<>();
        for (StatementRow row : rows) {
            values.add(row.getFormattedValue());
        }
        return values;
    }

    @Test
    void reconstructsIncomeStatementAtLatestQuarter() throws Exception {
        StatementTable table = engine().reconstructTable(FILING_A, StatementCode.IS, null, null);

        assertEquals(ResolvedContext.of(LocalDate.of(2024, 9, 30), 1), table.getContext());
        assertEquals(Arrays.asList("1,000,000", "600,000", "150,000", "250,000", "2.50"), formatted(table.getRows()));
        StatementRow netIncome = table.getRows().get(3);
        assertNull(netIncome.getCoreg());
        assertEquals(1, netIncome.getCandidateCount());
    }

    @Test
    void pinnedYearToDateContext() throws Exception {
        List<StatementRow> rows =
                engine().reconstructStatement(FILING_A, StatementCode.IS, LocalDate.of(2024, 9, 30), 3);

        assertEquals("2,900,000", rows.get(0).getFormattedValue());
        assertEquals("750,000", rows.get(3).getFormattedValue());
    }

    @Test
    void equityRollForwardUsesBoundaryBalances() throws Exception {
        List<StatementRow> rows = engine().reconstructStatement(FILING_A, StatementCode.EQ);

        assertEquals(Arrays.asList("380,000", "750,000", "(40,000)", "450,000"), formatted(rows));
        assertEquals(LocalDate.of(2023, 12, 31), rows.get(0).getEndDate());
        assertEquals(Integer.valueOf(0), rows.get(0).getDuration());
    }

    @Test
    void comprehensiveIncomeFallsBackToFacts() throws Exception {
        StatementTable table = engine().reconstructTable(FILING_A, StatementCode.CI, null, null);

        assertTrue(table.isSynthesized());
        assertEquals(2, table.getRows().size());
        assertEquals("ComprehensiveIncomeNetOfTax", table.getRows().get(0).getTag());
        assertEquals("Comprehensive Income (Loss), Net of Tax, Attributable to Parent", table.getRows().get(0).getLabel());
        assertEquals("260,000", table.getRows().get(0).getFormattedValue());
        assertEquals("Other Comprehensive Income (Loss), Net of Tax", table.getRows().get(1).getLabel());
        assertEquals("10,000", table.getRows().get(1).getFormattedValue());
        assertEquals(ResolvedContext.of(LocalDate.of(2024, 9, 30), 1), table.getContext());
    }

    @Test
    void reconstructFilingFollowsRequestedOrder() throws Exception {
        Map<StatementCode, List<StatementRow>> tables =
                engine().reconstructFiling(FILING_A, List.of(StatementCode.CF, StatementCode.BS));

        assertEquals(List.of(StatementCode.CF, StatementCode.BS), List.copyOf(tables.keySet()));
        assertEquals(7, tables.get(StatementCode.CF).size());
        assertEquals(9, tables.get(StatementCode.BS).size());
    }

    @Test
    void reconstructFilingDefaultsToCoreStatements() throws Exception {
        Map<StatementCode, List<StatementRow>> tables = engine().reconstructFiling(FILING_A);

        assertEquals(StatementCode.CORE, List.copyOf(tables.keySet()));
    }

    @Test
    void coverageOfBalanceSheet() throws Exception {
        StatementCoverage coverage = engine().coverage(FILING_A, StatementCode.BS);

        assertEquals(9, coverage.getRowsTotal());
        assertEquals(6, coverage.getRowsWithValue());
        assertEquals(
                List.of("AssetsAbstract", "LiabilitiesAndStockholdersEquityAbstract", "CommitmentsAndContingencies"),
                coverage.getMissingTags());
    }

    @Test
    void cleanFilingPasses() throws Exception {
        FilingValidationReport report = engine().validateFiling(FILING_A);

        assertEquals(ValidationStatus.PASS, report.getStatus());
        FilingSummary summary = report.getSummary();
        assertEquals(27, summary.getRowsTotal());
        assertEquals(24, summary.getRowsWithValue());
        assertEquals(0, summary.getDuplicateCandidateRows());
        assertEquals(0, summary.getUnexpectedMissingRows());

        StatementDiagnostics balanceSheet = report.getStatement(StatementCode.BS);
        assertTrue(balanceSheet.getStructuralParity().isPassed());
        assertEquals(3, balanceSheet.getMissingValues().getExpected().size());
        SubtotalCheck equation = balanceSheet.getSubtotalChecks().get(0);
        assertTrue(equation.isPassed());
        assertEquals(0, equation.getDelta().signum());

        StatementDiagnostics cashFlow = report.getStatement(StatementCode.CF);
        assertEquals("net_change", cashFlow.getSubtotalChecks().get(0).getVariant());
        assertEquals(1, cashFlow.getContextCoherence().getPeriodContexts());
        assertEquals(2, cashFlow.getContextCoherence().getInstantContexts());

        assertFalse(report.getStatement(StatementCode.CI).getStructuralParity().isApplicable());
    }

    @Test
    void inconsistentFilingFails() throws Exception {
        FilingValidationReport report = engine().validateFiling(FILING_B);

        assertEquals(ValidationStatus.FAIL, report.getStatus());
        FilingSummary summary = report.getSummary();
        assertEquals(1, summary.getSubtotalFailures());
        assertEquals(1, summary.getConflictingCandidateRows());
        assertEquals(1, summary.getDuplicateCandidateRows());
        assertEquals(2, summary.getUnexpectedMissingRows());
        assertEquals(0, summary.getContextWarnings());

        SubtotalCheck equation = report.getStatement(StatementCode.BS).getSubtotalChecks().get(0);
        assertEquals(0, new BigDecimal("1000").compareTo(equation.getDelta()));

        RowReference conflict = report.getStatement(StatementCode.IS).getCandidates().getConflictRows().get(0);
        assertEquals("Revenues", conflict.getTag());
        assertEquals(2, conflict.getCandidateCount());
        assertEquals(2, conflict.getCandidateUniqueValues());
        assertEquals(
                "5,100,000", engine().reconstructStatement(FILING_B, StatementCode.IS).get(0).getFormattedValue());
    }

    @Test
    void filingWithoutDataPassesEmpty() throws Exception {
        FilingValidationReport report = engine().validateFiling(FILING_C);

        assertEquals(ValidationStatus.PASS, report.getStatus());
        assertEquals(0, report.getSummary().getRowsTotal());
        assertEquals(0.0, report.getSummary().getOverallCoverageRatio());
    }

    @Test
    void validateFilingHonorsRequestedStatements() throws Exception {
        FilingValidationReport report = engine().validateFiling(FILING_B, List.of(StatementCode.IS));

        assertEquals(List.of(StatementCode.IS), List.copyOf(report.getStatements().keySet()));
        assertEquals(ValidationStatus.WARN, report.getStatus());
    }

    @Test
    void validatingBuiltTablesMatchesValidatingTheFiling() throws Exception {
        StatementEngine engine = engine();
        List<StatementTable> tables = new ArrayList<>();
        for (StatementCode code : StatementCode.CORE) {
            tables.add(engine.reconstructTable(FILING_B, code, null, null));
        }

        FilingValidationReport fromTables = engine.validateTables(FILING_B, tables);
        FilingValidationReport fromFiling = engine.validateFiling(FILING_B);

        assertEquals(List.copyOf(fromFiling.getStatements().keySet()), List.copyOf(fromTables.getStatements().keySet()));
        assertEquals(fromFiling.getStatus(), fromTables.getStatus());
        FilingSummary expected = fromFiling.getSummary();
        FilingSummary actual = fromTables.getSummary();
        assertEquals(expected.getRowsTotal(), actual.getRowsTotal());
        assertEquals(expected.getRowsWithValue(), actual.getRowsWithValue());
        assertEquals(expected.getSubtotalFailures(), actual.getSubtotalFailures());
        assertEquals(expected.getConflictingCandidateRows(), actual.getConflictingCandidateRows());
        assertEquals(expected.getUnexpectedMissingRows(), actual.getUnexpectedMissingRows());
        assertTrue(fromTables.getStatement(StatementCode.BS).getStructuralParity().isPassed());
    }

    @Test
    void validateTablesRejectsForeignOrRepeatedTables() throws Exception {
        StatementEngine engine = engine();
        StatementTable balanceSheetA = engine.reconstructTable(FILING_A, StatementCode.BS, null, null);
        StatementTable balanceSheetB = engine.reconstructTable(FILING_B, StatementCode.BS, null, null);

        assertThrows(IllegalArgumentException.class, () -> engine.validateTables(FILING_B, List.of(balanceSheetA)));
        assertThrows(
                IllegalArgumentException.class,
                () -> engine.validateTables(FILING_B, List.of(balanceSheetB, balanceSheetB)));
    }

    @Test
    void batchDeduplicatesAndTallies() throws Exception {
        BatchValidationReport batch = engine().validateBatch(List.of(FILING_A, FILING_B, FILING_C, FILING_A));

        assertEquals(3, batch.getCount());
        assertEquals(List.of(FILING_A, FILING_B, FILING_C), List.copyOf(batch.getResults().keySet()));
        assertEquals(2, batch.getStatusCounts().count(ValidationStatus.PASS));
        assertEquals(0, batch.getStatusCounts().count(ValidationStatus.WARN));
        assertEquals(1, batch.getStatusCounts().count(ValidationStatus.FAIL));
    }

    @Test
    void batchResultsDoNotDependOnParallelism() throws Exception {
        List<String> ids = List.of(FILING_B, FILING_A, FILING_C);
        EngineOptions serial = new EngineOptions(BigDecimal.ONE, 1, StatementCode.CORE);
        EngineOptions parallel = new EngineOptions(BigDecimal.ONE, 4, StatementCode.CORE);

        BatchValidationReport one = engine(serial).validateBatch(ids);
        BatchValidationReport many = engine(parallel).validateBatch(ids);

        assertEquals(one.getStatusCounts(), many.getStatusCounts());
        assertEquals(List.copyOf(one.getResults().keySet()), List.copyOf(many.getResults().keySet()));
        for (String id : ids) {
            assertEquals(one.getResults().get(id).getStatus(), many.getResults().get(id).getStatus());
        }
    }

    @Test
    void emptyBatchIsEmpty() throws Exception {
        BatchValidationReport batch = engine().validateBatch(List.of());

        assertEquals(0, batch.getCount());
        assertEquals(0, batch.getStatusCounts().total());
    }

    @Test
    void widerToleranceAcceptsSmallImbalance() throws Exception {
        EngineOptions lenient = new EngineOptions(new BigDecimal("1000"), 1, List.of(StatementCode.BS));

        FilingValidationReport report = engine(lenient).validateFiling(FILING_B);

        assertEquals(0, report.getSummary().getSubtotalFailures());
        assertEquals(ValidationStatus.PASS, report.getStatus());
    }

    @Test
    void nullFilingIdIsRejected() throws Exception {
        StatementEngine engine = engine();

        assertThrows(NullPointerException.class, () -> engine.validateFiling(null));
        assertThrows(NullPointerException.class, () -> engine.validateBatch(Arrays.asList(FILING_A, null)));
    }
}
