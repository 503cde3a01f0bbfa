package com.secrecon.engine;

import com.secrecon.assemble.StatementAssembler;
import com.secrecon.assemble.StatementCoverage;
import com.secrecon.assemble.StatementTable;
import com.secrecon.model.PresentationRow;
import com.secrecon.model.StatementCode;
import com.secrecon.model.StatementRow;
import com.secrecon.store.FactStore;
import com.secrecon.store.FilingDataset;
import com.secrecon.store.LabelLookup;
import com.secrecon.store.PresentationStore;
import com.secrecon.validate.BatchValidationReport;
import com.secrecon.validate.FilingValidationReport;
import com.secrecon.validate.StatementDiagnostics;
import com.secrecon.validate.StatementValidator;
import com.secrecon.validate.StatusTally;
import com.secrecon.validate.SubtotalRunner;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for reconstructing and validating statements over a read-only store snapshot.
 * Instances hold no mutable state and may be shared between threads.
 */
public final class StatementEngine {
    private static final Logger LOGGER = Logger.getLogger(StatementEngine.class.getName());

    private final EngineOptions options;
    private final StatementAssembler assembler;
    private final StatementValidator validator;

    public StatementEngine(
            FactStore facts, PresentationStore presentation, LabelLookup labels, EngineOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.assembler = new StatementAssembler(facts, presentation, labels);
        this.validator = new StatementValidator(SubtotalRunner.defaultRules(options.getSubtotalTolerance()));
    }

    public static StatementEngine over(FilingDataset dataset, EngineOptions options) {
        return new StatementEngine(dataset.getFacts(), dataset.getPresentation(), dataset.getTags(), options);
    }

    public EngineOptions getOptions() {
        return options;
    }

    public List<StatementRow> reconstructStatement(String filingId, StatementCode statement) {
        return reconstructStatement(filingId, statement, null, null);
    }

    /**
     * Rows of one statement in display order.
     *
     * @param endDate pinned end date, or {@code null} to infer it
     * @param duration pinned duration in quarters, or {@code null} to infer it
     */
    public List<StatementRow> reconstructStatement(
            String filingId, StatementCode statement, LocalDate endDate, Integer duration) {
        return reconstructTable(filingId, statement, endDate, duration).getRows();
    }

    /** Like {@link #reconstructStatement} but keeps the resolved context alongside the rows. */
    public StatementTable reconstructTable(
            String filingId, StatementCode statement, LocalDate endDate, Integer duration) {
        return assembler.assemble(filingId, statement, endDate, duration);
    }

    public Map<StatementCode, List<StatementRow>> reconstructFiling(String filingId) {
        return reconstructFiling(filingId, options.getStatementCodes());
    }

    /** Rows per statement code, in the order the codes are given. */
    public Map<StatementCode, List<StatementRow>> reconstructFiling(
            String filingId, Collection<StatementCode> statements) {
        Objects.requireNonNull(filingId, "filingId");
        Map<StatementCode, List<StatementRow>> tables = new LinkedHashMap<>();
        for (StatementCode statement : codesOrDefault(statements)) {
            tables.put(statement, reconstructStatement(filingId, statement));
        }
        return Collections.unmodifiableMap(tables);
    }

    public StatementCoverage coverage(String filingId, StatementCode statement) {
        return StatementCoverage.of(statement, reconstructStatement(filingId, statement));
    }

    public FilingValidationReport validateFiling(String filingId) {
        return validateFiling(filingId, options.getStatementCodes());
    }

    public FilingValidationReport validateFiling(String filingId, Collection<StatementCode> statements) {
        Objects.requireNonNull(filingId, "filingId");
        Map<StatementCode, StatementDiagnostics> diagnostics = new LinkedHashMap<>();
        for (StatementCode statement : codesOrDefault(statements)) {
            diagnostics.put(statement, validateStatement(filingId, statement));
        }
        return new FilingValidationReport(filingId, diagnostics);
    }

    /** Reconstructs one statement with inferred context and runs every check on it. */
    public StatementDiagnostics validateStatement(String filingId, StatementCode statement) {
        return validateTable(assembler.assemble(filingId, statement, null, null));
    }

    /** Runs every check on a table that has already been reconstructed. */
    public StatementDiagnostics validateTable(StatementTable table) {
        Objects.requireNonNull(table, "table");
        List<PresentationRow> structure =
                table.isSynthesized()
                        ? List.of()
                        : assembler.sortedStructure(table.getFilingId(), table.getStatement());
        return validator.validate(table, structure);
    }

    /**
     * Validation report of one filing built from tables already reconstructed for it, in the order
     * given.
     *
     * @throws IllegalArgumentException when a table belongs to another filing or a statement code
     *     repeats
     */
    public FilingValidationReport validateTables(String filingId, Collection<StatementTable> tables) {
        Objects.requireNonNull(filingId, "filingId");
        Map<StatementCode, StatementDiagnostics> diagnostics = new LinkedHashMap<>();
        for (StatementTable table : tables) {
            if (!filingId.equals(table.getFilingId())) {
                throw new IllegalArgumentException(
                        "Table " + table.getStatement() + " of " + table.getFilingId() + " is not part of " + filingId);
            }
            if (diagnostics.put(table.getStatement(), validateTable(table)) != null) {
                throw new IllegalArgumentException("Statement " + table.getStatement() + " given twice for " + filingId);
            }
        }
        return new FilingValidationReport(filingId, diagnostics);
    }

    public BatchValidationReport validateBatch(Collection<String> filingIds) {
        return validateBatch(filingIds, options.getStatementCodes());
    }

    /**
     * Validates many filings on a worker pool sized by {@link EngineOptions#getBatchParallelism()}.
     * Duplicate ids are validated once; results keep the order of first appearance.
     *
     * @throws IllegalStateException when the calling thread is interrupted while waiting
     */
    public BatchValidationReport validateBatch(Collection<String> filingIds, Collection<StatementCode> statements) {
        Objects.requireNonNull(filingIds, "filingIds");
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(filingIds));
        for (String id : ids) {
            Objects.requireNonNull(id, "filingId");
        }
        List<StatementCode> codes = codesOrDefault(statements);
        Map<String, FilingValidationReport> results = new LinkedHashMap<>();
        StatusTally tally = StatusTally.empty();
        if (ids.isEmpty()) {
            return new BatchValidationReport(results, tally);
        }

        int workers = Math.min(options.getBatchParallelism(), ids.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<Future<FilingValidationReport>> futures = new ArrayList<>(ids.size());
            for (String id : ids) {
                futures.add(executor.submit(() -> validateFiling(id, codes)));
            }
            for (Future<FilingValidationReport> future : futures) {
                FilingValidationReport report = await(future);
                results.put(report.getFilingId(), report);
                tally = tally.merge(StatusTally.of(report.getStatus()));
            }
        } finally {
            executor.shutdownNow();
        }
        LOGGER.log(Level.INFO, "Validated {0} filings: {1}", new Object[] {results.size(), tally});
        return new BatchValidationReport(results, tally);
    }

    private static FilingValidationReport await(Future<FilingValidationReport> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while validating batch", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Filing validation failed", cause);
        }
    }

    private List<StatementCode> codesOrDefault(Collection<StatementCode> statements) {
        if (statements == null || statements.isEmpty()) {
            return options.getStatementCodes();
        }
        List<StatementCode> codes = new ArrayList<>(statements.size());
        for (StatementCode statement : statements) {
            codes.add(Objects.requireNonNull(statement, "statement"));
        }
        return codes;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "secrecon-batch-" + pool + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
