package com.secrecon.tools;

import com.secrecon.engine.EngineOptions;
import com.secrecon.engine.StatementEngine;
import com.secrecon.loader.DatasetLoader;
import com.secrecon.loader.LoaderMessage;
import com.secrecon.loader.LoaderResult;
import com.secrecon.model.StatementCode;
import com.secrecon.store.FilingDataset;
import com.secrecon.validate.BatchScoreboard;
import com.secrecon.validate.BatchValidationReport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Validates a sample of filings from one dataset directory and prints the batch scoreboard.
 * Filings are sampled newest first, one per company.
 */
public final class BatchValidationCli {

    private static final int DEFAULT_LIMIT = 25;

    private BatchValidationCli() {}

    public static void main(String[] args) throws Exception {
        if (args.length < 1 || args.length > 4) {
            System.err.println("Usage: BatchValidationCli <dataset dir> [limit] [forms, e.g. 10-K,10-Q] [statement codes]");
            System.exit(1);
        }
        Path dataset = Path.of(args[0]).toAbsolutePath().normalize();
        if (!Files.isDirectory(dataset)) {
            throw new IllegalStateException("Dataset directory not found: " + dataset);
        }
        int limit = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_LIMIT;
        List<String> forms = args.length > 2 ? splitList(args[2]) : List.of();
        List<StatementCode> codes = args.length > 3 ? StatementCode.parseList(args[3]) : List.of();
        System.out.print(run(dataset, limit, forms, codes).render());
    }

    static BatchScoreboard run(Path dataset, int limit, List<String> forms, List<StatementCode> codes)
            throws Exception {
        LoaderResult loaded = new DatasetLoader().load(dataset);
        for (LoaderMessage message : loaded.getMessages()) {
            System.err.println(message);
        }
        FilingDataset data = loaded.getDataset();
        StatementEngine engine = StatementEngine.over(data, EngineOptions.fromProperties(System.getProperties()));
        List<String> filings = data.getSubmissions().sample(limit, forms, true);
        BatchValidationReport report = engine.validateBatch(filings, codes);
        return BatchScoreboard.summarize(report);
    }

    private static List<String> splitList(String text) {
        return Arrays.stream(text.split(",")).map(String::trim).filter(part -> !part.isEmpty()).toList();
    }
}
