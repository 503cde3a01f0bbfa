package com.secrecon.loader;

import com.secrecon.model.NumericFact;
import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementCode;
import com.secrecon.model.SubmissionRecord;
import com.secrecon.model.TagRecord;
import com.secrecon.store.FilingDataset;
import com.secrecon.store.InMemoryFactStore;
import com.secrecon.store.InMemoryPresentationStore;
import com.secrecon.store.SubmissionIndex;
import com.secrecon.store.TagLabelLookup;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a directory holding the regulator tables {@code num.txt}, {@code pre.txt}, {@code tag.txt}
 * and {@code sub.txt} into typed, immutable stores. Fields that cannot be parsed become absent; the
 * number of such fields per file is reported as one warning.
 */
public final class DatasetLoader {
    private static final Logger LOGGER = Logger.getLogger(DatasetLoader.class.getName());

    static final String NUM_FILE = "num.txt";
    static final String PRE_FILE = "pre.txt";
    static final String TAG_FILE = "tag.txt";
    static final String SUB_FILE = "sub.txt";

    private static final List<String> NUM_COLUMNS =
            List.of("adsh", "tag", "version", "ddate", "qtrs", "uom", "segments", "coreg", "value");
    private static final List<String> PRE_COLUMNS =
            List.of("adsh", "report", "line", "stmt", "inpth", "rfile", "tag", "version", "plabel", "negating");
    private static final List<String> TAG_COLUMNS = List.of("tag", "version", "tlabel");
    private static final List<String> SUB_COLUMNS = List.of("adsh", "cik", "name", "form", "filed");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    public LoaderResult load(Path directory) throws LoaderException {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new LoaderException("Dataset directory not found: " + directory);
        }
        List<LoaderMessage> messages = new ArrayList<>();

        List<NumericFact> facts;
        try (TabularFile num = TabularFile.open(requireFile(directory, NUM_FILE), NUM_COLUMNS)) {
            facts = readFacts(num, messages);
        }
        List<PresentationRow> rows;
        try (TabularFile pre = TabularFile.open(requireFile(directory, PRE_FILE), PRE_COLUMNS)) {
            rows = readPresentation(pre, messages);
        }

        List<TagRecord> tags = List.of();
        Path tagPath = directory.resolve(TAG_FILE);
        if (Files.isRegularFile(tagPath)) {
            try (TabularFile tag = TabularFile.open(tagPath, TAG_COLUMNS)) {
                tags = readTags(tag, messages);
            }
        } else {
            messages.add(info("No " + TAG_FILE + " found; concept labels unavailable", TAG_FILE));
        }

        List<SubmissionRecord> submissions = List.of();
        Path subPath = directory.resolve(SUB_FILE);
        if (Files.isRegularFile(subPath)) {
            try (TabularFile sub = TabularFile.open(subPath, SUB_COLUMNS)) {
                submissions = readSubmissions(sub, messages);
            }
        } else {
            messages.add(info("No " + SUB_FILE + " found; submission index is empty", SUB_FILE));
        }

        FilingDataset dataset =
                new FilingDataset(
                        new InMemoryFactStore(facts),
                        new InMemoryPresentationStore(rows),
                        new TagLabelLookup(tags),
                        new SubmissionIndex(submissions));
        LOGGER.log(
                Level.INFO,
                "Loaded {0} facts, {1} presentation rows, {2} tags, {3} submissions from {4}",
                new Object[] {facts.size(), rows.size(), tags.size(), submissions.size(), directory});
        return new LoaderResult(dataset, messages);
    }

    private static Path requireFile(Path directory, String name) throws LoaderException {
        Path path = directory.resolve(name);
        if (!Files.isRegularFile(path)) {
            throw new LoaderException("Required table " + name + " not found in " + directory);
        }
        return path;
    }

    private List<NumericFact> readFacts(TabularFile file, List<LoaderMessage> messages)
            throws LoaderException {
        MalformedTally tally = new MalformedTally(file);
        List<NumericFact> facts = new ArrayList<>();
        String[] cells;
        while ((cells = file.next()) != null) {
            int line = file.lineNumber();
            String adsh = file.field(cells, "adsh");
            String tag = file.field(cells, "tag");
            if (adsh == null || tag == null) {
                tally.skip(line, "missing adsh or tag");
                continue;
            }
            Integer duration = tally.integer(file.field(cells, "qtrs"), line, "qtrs");
            if (duration != null && duration < 0) {
                tally.malformed(line, "qtrs", duration.toString());
                duration = null;
            }
            facts.add(
                    new NumericFact(
                            adsh,
                            tag,
                            file.field(cells, "version"),
                            tally.date(file.field(cells, "ddate"), line, "ddate"),
                            duration,
                            file.field(cells, "uom"),
                            file.field(cells, "coreg"),
                            file.field(cells, "segments"),
                            tally.decimal(file.field(cells, "value"), line, "value")));
        }
        tally.report(messages);
        return facts;
    }

    private List<PresentationRow> readPresentation(TabularFile file, List<LoaderMessage> messages)
            throws LoaderException {
        MalformedTally tally = new MalformedTally(file);
        List<PresentationRow> rows = new ArrayList<>();
        String[] cells;
        while ((cells = file.next()) != null) {
            int line = file.lineNumber();
            String adsh = file.field(cells, "adsh");
            String tag = file.field(cells, "tag");
            String stmt = file.field(cells, "stmt");
            if (adsh == null || tag == null || stmt == null) {
                tally.skip(line, "missing adsh, tag or stmt");
                continue;
            }
            StatementCode code;
            try {
                code = StatementCode.of(stmt);
            } catch (IllegalArgumentException e) {
                tally.malformed(line, "stmt", stmt);
                tally.skip(line, e.getMessage());
                continue;
            }
            Integer report = tally.integer(file.field(cells, "report"), line, "report");
            Integer lineNo = tally.integer(file.field(cells, "line"), line, "line");
            if (report == null || lineNo == null) {
                tally.skip(line, "row cannot be ordered without report and line");
                continue;
            }
            Integer depth = tally.integer(file.field(cells, "inpth"), line, "inpth");
            rows.add(
                    new PresentationRow(
                            adsh,
                            code,
                            report,
                            lineNo,
                            depth == null ? 0 : depth,
                            file.field(cells, "rfile"),
                            tag,
                            file.field(cells, "version"),
                            file.field(cells, "plabel"),
                            "1".equals(file.field(cells, "negating"))));
        }
        tally.report(messages);
        return rows;
    }

    private List<TagRecord> readTags(TabularFile file, List<LoaderMessage> messages)
            throws LoaderException {
        MalformedTally tally = new MalformedTally(file);
        List<TagRecord> tags = new ArrayList<>();
        String[] cells;
        while ((cells = file.next()) != null) {
            String tag = file.field(cells, "tag");
            if (tag == null) {
                tally.skip(file.lineNumber(), "missing tag");
                continue;
            }
            tags.add(
                    new TagRecord(
                            tag,
                            file.field(cells, "version"),
                            "1".equals(file.field(cells, "custom")),
                            "1".equals(file.field(cells, "abstract")),
                            file.field(cells, "datatype"),
                            file.field(cells, "crdr"),
                            file.field(cells, "tlabel"),
                            file.field(cells, "doc")));
        }
        tally.report(messages);
        return tags;
    }

    private List<SubmissionRecord> readSubmissions(TabularFile file, List<LoaderMessage> messages)
            throws LoaderException {
        MalformedTally tally = new MalformedTally(file);
        List<SubmissionRecord> submissions = new ArrayList<>();
        String[] cells;
        while ((cells = file.next()) != null) {
            int line = file.lineNumber();
            String adsh = file.field(cells, "adsh");
            if (adsh == null) {
                tally.skip(line, "missing adsh");
                continue;
            }
            submissions.add(
                    new SubmissionRecord(
                            adsh,
                            file.field(cells, "cik"),
                            file.field(cells, "name"),
                            file.field(cells, "sic"),
                            file.field(cells, "form"),
                            tally.date(file.field(cells, "period"), line, "period"),
                            tally.integer(file.field(cells, "fy"), line, "fy"),
                            file.field(cells, "fp"),
                            tally.date(file.field(cells, "filed"), line, "filed"),
                            file.field(cells, "countryinc")));
        }
        tally.report(messages);
        return submissions;
    }

    private static LoaderMessage info(String message, String fileName) {
        LOGGER.info(message);
        return new LoaderMessage(LoaderMessage.Level.INFO, message, fileName, 0);
    }

    /** Counts fields of one file that failed to parse and rows that had to be skipped. */
    private static final class MalformedTally {
        private final TabularFile file;
        private int malformedFields;
        private int skippedRows;
        private int firstLine;

        MalformedTally(TabularFile file) {
            this.file = file;
        }

        LocalDate date(String text, int line, String column) {
            if (text == null) {
                return null;
            }
            try {
                return LocalDate.parse(text, DATE_FORMAT);
            } catch (DateTimeParseException e) {
                malformed(line, column, text);
                return null;
            }
        }

        BigDecimal decimal(String text, int line, String column) {
            try {
                return DecimalParser.parse(text);
            } catch (NumberFormatException e) {
                malformed(line, column, text);
                return null;
            }
        }

        Integer integer(String text, int line, String column) {
            try {
                return DecimalParser.parseInteger(text);
            } catch (NumberFormatException e) {
                malformed(line, column, text);
                return null;
            }
        }

        void malformed(int line, String column, String text) {
            malformedFields++;
            if (firstLine == 0) {
                firstLine = line;
            }
            LOGGER.log(
                    Level.FINE,
                    "{0}:{1} malformed {2} value ''{3}''",
                    new Object[] {file.getFileName(), line, column, text});
        }

        void skip(int line, String reason) {
            skippedRows++;
            LOGGER.log(Level.FINE, "{0}:{1} skipped: {2}", new Object[] {file.getFileName(), line, reason});
        }

        void report(List<LoaderMessage> messages) {
            if (malformedFields == 0 && skippedRows == 0) {
                return;
            }
            String message =
                    malformedFields
                            + " malformed field(s) treated as absent, "
                            + skippedRows
                            + " row(s) skipped";
            LOGGER.log(Level.WARNING, "{0}: {1}", new Object[] {file.getFileName(), message});
            messages.add(new LoaderMessage(LoaderMessage.Level.WARNING, message, file.getFileName(), firstLine));
        }
    }
}
