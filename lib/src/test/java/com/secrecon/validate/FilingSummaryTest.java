package com.secrecon.validate;

import static com.secrecon.testing.Fixtures.row;
import static com.secrecon.testing.Fixtures.valued;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.secrecon.assemble.StatementTable;
import com.secrecon.model.PresentationRow;
import com.secrecon.model.ResolvedContext;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import com.secrecon.testing.Fixtures;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class FilingSummaryTest {

    private static final ResolvedContext CONTEXT = ResolvedContext.of(LocalDate.of(2024, 9, 30), 0);

    private final StatementValidator validator = new StatementValidator(SubtotalRunner.defaultRules(BigDecimal.ONE));

    private StatementDiagnostics balanceSheet(String assets, String total, int candidates, int unique) {
        PresentationRow assetsRow = row(StatementCode.BS, 1, "Assets", "Total assets");
        PresentationRow totalRow = row(StatementCode.BS, 2, "LiabilitiesAndStockholdersEquity", "Total");
        List<StatementRow> rows =
                List.of(
                        valued(assetsRow, assets, "2024-09-30", 0, candidates, unique),
                        valued(totalRow, total, "2024-09-30", 0));
        StatementTable table = new StatementTable(Fixtures.FILING, StatementCode.BS, CONTEXT, null, false, rows);
        return validator.validate(table, List.of(assetsRow, totalRow));
    }

    private static FilingValidationReport report(StatementDiagnostics... diagnostics) {
        Map<StatementCode, StatementDiagnostics> statements = new LinkedHashMap<>();
        for (StatementDiagnostics entry : diagnostics) {
            statements.put(entry.getStatement(), entry);
        }
        return new FilingValidationReport(Fixtures.FILING, statements);
    }

    @Test
    void cleanFilingPasses() {
        FilingValidationReport report = report(balanceSheet("100", "100", 1, 1));

        assertEquals(ValidationStatus.PASS, report.getStatus());
        assertEquals(2, report.getSummary().getRowsTotal());
        assertEquals(1.0, report.getSummary().getOverallCoverageRatio(), 1e-9);
        assertTrue(report.getStatement(StatementCode.BS).isHealthy());
    }

    @Test
    void duplicatesAloneDoNotDegradeStatus() {
        FilingValidationReport report = report(balanceSheet("100", "100", 3, 1));

        assertEquals(1, report.getSummary().getDuplicateCandidateRows());
        assertEquals(ValidationStatus.PASS, report.getStatus());
    }

    @Test
    void conflictingCandidatesWarn() {
        FilingValidationReport report = report(balanceSheet("100", "100", 2, 2));

        assertEquals(1, report.getSummary().getConflictingCandidateRows());
        assertEquals(ValidationStatus.WARN, report.getStatus());
    }

    @Test
    void subtotalFailureFailsEvenWithWarnings() {
        FilingValidationReport report = report(balanceSheet("100", "90", 2, 2));

        assertEquals(1, report.getSummary().getSubtotalFailures());
        assertEquals(ValidationStatus.FAIL, report.getStatus());
        assertFalse(report.getStatement(StatementCode.BS).isHealthy());
    }

    @Test
    void structuralMismatchFails() {
        PresentationRow assetsRow = row(StatementCode.BS, 1, "Assets", "Total assets");
        StatementTable table =
                new StatementTable(
                        Fixtures.FILING,
                        StatementCode.BS,
                        CONTEXT,
                        null,
                        false,
                        List.of(valued(assetsRow, "100", "2024-09-30", 0)));

        StatementDiagnostics diagnostics =
                validator.validate(table, List.of(assetsRow, row(StatementCode.BS, 2, "Liabilities", "Liabilities")));

        assertEquals(ValidationStatus.FAIL, report(diagnostics).getStatus());
        assertEquals(1, report(diagnostics).getSummary().getStructuralFailures());
    }

    @Test
    void incoherentContextsWarn() {
        PresentationRow revenues = row(StatementCode.IS, 1, "Revenues", "Revenues");
        PresentationRow cost = row(StatementCode.IS, 2, "CostOfRevenue", "Cost");
        StatementTable table =
                new StatementTable(
                        Fixtures.FILING,
                        StatementCode.IS,
                        ResolvedContext.of(LocalDate.of(2024, 9, 30), 3),
                        null,
                        false,
                        List.of(valued(revenues, "10", "2024-09-30", 3), valued(cost, "4", "2024-09-30", 1)));

        FilingValidationReport report = report(validator.validate(table, List.of(revenues, cost)));

        assertEquals(1, report.getSummary().getContextWarnings());
        assertEquals(ValidationStatus.WARN, report.getStatus());
    }

    @Test
    void emptyFilingPassesWithZeroCoverage() {
        FilingValidationReport report = report();

        assertEquals(ValidationStatus.PASS, report.getStatus());
        assertEquals(0.0, report.getSummary().getOverallCoverageRatio());
    }

    @Test
    void statusLabelsAreLowerCase() {
        assertEquals("warn", ValidationStatus.WARN.getLabel());
    }
}
