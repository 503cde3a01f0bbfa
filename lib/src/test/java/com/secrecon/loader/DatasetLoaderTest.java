package com.secrecon.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.secrecon.model.NumericFact;
import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementCode;
import com.secrecon.store.FilingDataset;
import com.secrecon.testing.TestResources;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class DatasetLoaderTest {

    private static final String NUM_HEADER = "adsh\ttag\tversion\tddate\tqtrs\tuom\tsegments\tcoreg\tvalue\n";
    private static final String PRE_HEADER = "adsh\treport\tline\tstmt\tinpth\trfile\ttag\tversion\tplabel\tnegating\n";

    @TempDir Path tempDir;

    @Test
    void loadsFixtureDataset() throws Exception {
        LoaderResult result = new DatasetLoader().load(TestResources.datasetDir());
        FilingDataset dataset = result.getDataset();

        assertEquals(37, dataset.getFacts().size());
        assertEquals(31, dataset.getPresentation().size());
        assertEquals(21, dataset.getTags().allTags().size());
        assertEquals(3, dataset.getSubmissions().size());
        assertEquals(
                List.of(TestResources.FILING_A, TestResources.FILING_B, TestResources.FILING_C),
                List.copyOf(dataset.filingIds()));
    }

    @Test
    void typesFieldsAtConstruction() throws Exception {
        FilingDataset dataset = new DatasetLoader().load(TestResources.datasetDir()).getDataset();

        NumericFact eps =
                dataset.getFacts().factsFor(TestResources.FILING_A).stream()
                        .filter(fact -> fact.getTag().equals("EarningsPerShareBasic"))
                        .findFirst()
                        .orElseThrow();
        assertEquals(LocalDate.of(2024, 9, 30), eps.getEndDate());
        assertEquals(Integer.valueOf(1), eps.getDuration());
        assertEquals("USD/shares", eps.getUnit());
        assertEquals(0, eps.getValue().compareTo(new BigDecimal("2.5")));
        assertTrue(eps.isPrimary());

        PresentationRow dividends =
                dataset.getPresentation().structureFor(TestResources.FILING_A, StatementCode.EQ).stream()
                        .filter(row -> row.getTag().equals("PaymentsOfDividends"))
                        .findFirst()
                        .orElseThrow();
        assertTrue(dividends.isNegating());
        assertEquals(1, dividends.getDepth());
        assertEquals("Dividends paid", dividends.getLabel());
    }

    @Test
    void malformedFieldsBecomeAbsentAndAreReportedOncePerFile() throws Exception {
        LoaderResult result = new DatasetLoader().load(TestResources.datasetDir());

        List<LoaderMessage> warnings = result.messagesAt(LoaderMessage.Level.WARNING);
        assertEquals(1, warnings.size());
        LoaderMessage warning = warnings.get(0);
        assertEquals("num.txt", warning.getSourceFilename());
        assertEquals(33, warning.getSourceLineno());
        assertTrue(warning.getMessage().startsWith("2 malformed field(s)"), warning.getMessage());

        List<NumericFact> facts = result.getDataset().getFacts().factsFor(TestResources.FILING_B);
        NumericFact liabilities =
                facts.stream().filter(fact -> fact.getTag().equals("Liabilities")).findFirst().orElseThrow();
        assertNull(liabilities.getValue());
        long undatedAssets =
                facts.stream().filter(fact -> fact.getTag().equals("Assets") && fact.getEndDate() == null).count();
        assertEquals(1, undatedAssets);
    }

    @Test
    void missingDirectoryFails() {
        assertThrows(LoaderException.class, () -> new DatasetLoader().load(tempDir.resolve("absent")));
    }

    @Test
    void missingPresentationTableFails() throws IOException {
        Files.writeString(tempDir.resolve("num.txt"), NUM_HEADER, StandardCharsets.UTF_8);

        LoaderException error = assertThrows(LoaderException.class, () -> new DatasetLoader().load(tempDir));
        assertTrue(error.getMessage().contains("pre.txt"), error.getMessage());
    }

    @Test
    void missingRequiredColumnFails() throws IOException {
        Files.writeString(tempDir.resolve("num.txt"), "adsh\ttag\tversion\tddate\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("pre.txt"), PRE_HEADER, StandardCharsets.UTF_8);

        LoaderException error = assertThrows(LoaderException.class, () -> new DatasetLoader().load(tempDir));
        assertTrue(error.getMessage().contains("qtrs"), error.getMessage());
    }

    @Test
    void optionalTablesMayBeAbsent() throws Exception {
        Files.writeString(
                tempDir.resolve("num.txt"),
                NUM_HEADER + "x-1\tAssets\tus-gaap/2024\t20240930\t0\tUSD\t\t\t10\n",
                StandardCharsets.UTF_8);
        Files.writeString(
                tempDir.resolve("pre.txt"),
                PRE_HEADER + "x-1\t2\t1\tBS\t0\tH\tAssets\tus-gaap/2024\tTotal assets\t0\n",
                StandardCharsets.UTF_8);

        LoaderResult result = new DatasetLoader().load(tempDir);

        assertEquals(2, result.messagesAt(LoaderMessage.Level.INFO).size());
        assertTrue(result.messagesAt(LoaderMessage.Level.WARNING).isEmpty());
        assertFalse(result.getDataset().getTags().labelFor("Assets").isPresent());
        assertEquals(0, result.getDataset().getSubmissions().size());
        assertEquals(1, result.getDataset().getFacts().size());
    }

    @Test
    void presentationRowWithoutLineNumberIsSkipped() throws Exception {
        Files.writeString(tempDir.resolve("num.txt"), NUM_HEADER, StandardCharsets.UTF_8);
        Files.writeString(
                tempDir.resolve("pre.txt"),
                PRE_HEADER
                        + "x-1\t2\t1\tBS\t0\tH\tAssets\tus-gaap/2024\tTotal assets\t0\n"
                        + "x-1\t2\tfirst\tBS\t0\tH\tLiabilities\tus-gaap/2024\tTotal liabilities\t0\n"
                        + "x-1\t2\t3\tZZ\t0\tH\tEquity\tus-gaap/2024\tEquity\t0\n",
                StandardCharsets.UTF_8);

        LoaderResult result = new DatasetLoader().load(tempDir);

        List<PresentationRow> rows = result.getDataset().getPresentation().structureFor("x-1", StatementCode.BS);
        assertEquals(1, rows.size());
        assertEquals("Assets", rows.get(0).getTag());
        List<LoaderMessage> warnings = result.messagesAt(LoaderMessage.Level.WARNING);
        assertEquals(1, warnings.size());
        assertEquals("pre.txt", warnings.get(0).getSourceFilename());
        assertTrue(warnings.get(0).getMessage().contains("2 row(s) skipped"), warnings.get(0).getMessage());
    }

    @Test
    void columnsAreLocatedByHeaderName() throws Exception {
        Files.writeString(
                tempDir.resolve("num.txt"),
                "value\tadsh\tqtrs\tddate\ttag\tversion\tuom\tcoreg\tsegments\n"
                        + "42\tx-1\t0\t20240930\tAssets\tus-gaap/2024\tUSD\t\t\n",
                StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("pre.txt"), PRE_HEADER, StandardCharsets.UTF_8);

        NumericFact fact = new DatasetLoader().load(tempDir).getDataset().getFacts().factsFor("x-1").get(0);

        assertEquals("Assets", fact.getTag());
        assertEquals(0, fact.getValue().compareTo(new BigDecimal("42")));
        assertTrue(fact.isInstant());
    }
}
