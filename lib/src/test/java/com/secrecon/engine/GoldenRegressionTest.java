package com.secrecon.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.secrecon.loader.DatasetLoader;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import com.secrecon.testing.TestResources;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Compares reconstructions of the fixture filing with checked-in expected tables. */
final class GoldenRegressionTest {

    @Test
    void balanceSheetMatchesGolden() throws Exception {
        assertMatchesGolden(StatementCode.BS, "golden/balance_sheet_" + TestResources.FILING_A + ".tsv");
    }

    @Test
    void cashFlowMatchesGolden() throws Exception {
        assertMatchesGolden(StatementCode.CF, "golden/cash_flow_" + TestResources.FILING_A + ".tsv");
    }

    private static void assertMatchesGolden(StatementCode statement, String resource) throws Exception {
        Path golden = TestResources.resolveResource(resource);
        List<String> lines = Files.readAllLines(golden, StandardCharsets.UTF_8);
        List<String> expected = new ArrayList<>(lines.subList(1, lines.size()));
        expected.removeIf(String::isBlank);

        StatementEngine engine =
                StatementEngine.over(
                        new DatasetLoader().load(TestResources.datasetDir()).getDataset(), EngineOptions.defaults());
        List<String> actual = new ArrayList<>();
        for (StatementRow row : engine.reconstructStatement(TestResources.FILING_A, statement)) {
            actual.add(render(row));
        }

        assertEquals(expected, actual);
    }

    private static String render(StatementRow row) {
        return String.join(
                "\t",
                String.valueOf(row.getReport()),
                String.valueOf(row.getLine()),
                String.valueOf(row.getDepth()),
                row.getTag(),
                row.getLabel(),
                row.getFormattedValue() == null ? "" : row.getFormattedValue(),
                row.getEndDate() == null ? "" : row.getEndDate().toString(),
                row.getDuration() == null ? "" : row.getDuration().toString());
    }
}
