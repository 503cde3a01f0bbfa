package com.secrecon.jdbc.calcite;

import com.secrecon.assemble.StatementTable;
import com.secrecon.engine.EngineOptions;
import com.secrecon.engine.StatementEngine;
import com.secrecon.jdbc.dataset.DatasetProvider;
import com.secrecon.jdbc.schema.CandidateConflictsView;
import com.secrecon.jdbc.schema.FilingValidationTable;
import com.secrecon.jdbc.schema.MissingValuesView;
import com.secrecon.jdbc.schema.NumTable;
import com.secrecon.jdbc.schema.PreTable;
import com.secrecon.jdbc.schema.StatementRowsTable;
import com.secrecon.jdbc.schema.StatementValidationTable;
import com.secrecon.jdbc.schema.SubTable;
import com.secrecon.jdbc.schema.TableDefinition;
import com.secrecon.jdbc.schema.TagTable;
import com.secrecon.loader.LoaderException;
import com.secrecon.model.StatementCode;
import com.secrecon.resolve.FilingPeriod;
import com.secrecon.store.FilingDataset;
import com.secrecon.validate.BatchValidationReport;
import com.secrecon.validate.FilingValidationReport;
import com.secrecon.validate.StatusTally;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;
import org.apache.calcite.schema.impl.ViewTable;

/**
 * Calcite schema over one dataset directory. The raw tables and the reconstructed statement and
 * validation tables are materialized together on first access and never refreshed; views over
 * them are registered at the same time.
 */
public final class SecReconSchema extends AbstractSchema {
    private static final Logger LOGGER = Logger.getLogger(SecReconSchema.class.getName());

    public static final String DATASET_OPERAND = "dataset";
    static final String OPTION_PREFIX = "secrecon.";

    private static final Map<String, String> VIEW_SQL = buildViewSql();

    private final SchemaPlus parentSchema;
    private final String schemaName;
    private final Path datasetPath;
    private final EngineOptions options;
    private volatile Map<String, Table> tables;
    private volatile FilingDataset dataset;
    private volatile SchemaPlus schemaPlus;
    private final Object viewLock = new Object();
    private volatile boolean viewsRegistered;

    SecReconSchema(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        this(parentSchema, name, resolveDatasetPath(operand), null, optionsFrom(operand));
    }

    SecReconSchema(
            SchemaPlus parentSchema, String name, Path datasetPath, FilingDataset preloaded, EngineOptions options) {
        this.parentSchema = Objects.requireNonNull(parentSchema, "parentSchema");
        this.schemaName = Objects.requireNonNull(name, "name");
        this.datasetPath = Objects.requireNonNull(datasetPath, "datasetPath");
        this.options = Objects.requireNonNull(options, "options");
        this.dataset = preloaded;
    }

    @Override
    protected Map<String, Table> getTableMap() {
        Map<String, Table> local = tables;
        if (local == null) {
            synchronized (this) {
                local = tables;
                if (local == null) {
                    local = buildTables();
                }
            }
        }
        return local;
    }

    EngineOptions getOptions() {
        return options;
    }

    private Map<String, Table> buildTables() {
        FilingDataset data = loadDataset();
        StatementEngine engine = StatementEngine.over(data, options);
        List<String> filingIds = new ArrayList<>(data.filingIds());

        List<StatementTable> statements = new ArrayList<>();
        Map<String, FilingValidationReport> reports = new LinkedHashMap<>();
        StatusTally tally = StatusTally.empty();
        for (String filingId : filingIds) {
            List<StatementTable> filingTables = new ArrayList<>();
            for (StatementCode code : options.getStatementCodes()) {
                filingTables.add(engine.reconstructTable(filingId, code, null, null));
            }
            FilingValidationReport report = engine.validateTables(filingId, filingTables);
            reports.put(filingId, report);
            tally = tally.plus(report.getStatus());
            statements.addAll(filingTables);
        }
        BatchValidationReport validation = new BatchValidationReport(reports, tally);
        FilingPeriod periods = new FilingPeriod(data.getFacts(), data.getSubmissions());

        Map<String, Table> map = new LinkedHashMap<>();
        put(map, NumTable.getDefinition(), NumTable.materializeRows(data.getFacts().allFacts()));
        put(map, PreTable.getDefinition(), PreTable.materializeRows(data.getPresentation().allRows()));
        put(map, TagTable.getDefinition(), TagTable.materializeRows(data.getTags().allTags()));
        put(map, SubTable.getDefinition(), SubTable.materializeRows(data.getSubmissions().all()));
        put(map, StatementRowsTable.getDefinition(), StatementRowsTable.materializeRows(statements));
        put(map, StatementValidationTable.getDefinition(), StatementValidationTable.materializeRows(validation));
        put(map, FilingValidationTable.getDefinition(), FilingValidationTable.materializeRows(validation, periods));
        LOGGER.log(
                Level.INFO,
                "Materialized {0} filings, {1} statements from {2}",
                new Object[] {filingIds.size(), statements.size(), datasetPath});
        Map<String, Table> immutable = Map.copyOf(map);
        this.tables = immutable;
        registerViews();
        return immutable;
    }

    private static void put(Map<String, Table> map, TableDefinition definition, List<Object[]> rows) {
        map.put(definition.getName(), new DefinitionCalciteTable(definition, rows));
    }

    private FilingDataset loadDataset() {
        FilingDataset current = dataset;
        if (current == null) {
            try {
                current = DatasetProvider.load(datasetPath).getDataset();
            } catch (LoaderException ex) {
                throw new IllegalStateException("Failed to load dataset: " + datasetPath, ex);
            }
            dataset = current;
        }
        return current;
    }

    private static Path resolveDatasetPath(Map<String, Object> operand) {
        Object dataset = operand.get(DATASET_OPERAND);
        if (dataset == null) {
            throw new IllegalArgumentException("Schema operand must include '" + DATASET_OPERAND + "'");
        }
        return Paths.get(dataset.toString()).toAbsolutePath().normalize();
    }

    /** Engine options read from operand entries named like {@link EngineOptions} keys. */
    static EngineOptions optionsFrom(Map<String, ?> values) {
        Properties properties = new Properties();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (entry.getKey().startsWith(OPTION_PREFIX) && entry.getValue() != null) {
                properties.setProperty(entry.getKey(), entry.getValue().toString());
            }
        }
        return EngineOptions.fromProperties(properties);
    }

    private void registerViews() {
        if (viewsRegistered) {
            return;
        }
        synchronized (viewLock) {
            if (viewsRegistered) {
                return;
            }
            viewsRegistered = true;
            SchemaPlus schema = resolveSchemaPlus();
            List<String> schemaPath = buildSchemaPath(schema);
            for (Map.Entry<String, String> entry : VIEW_SQL.entrySet()) {
                List<String> viewPath = new ArrayList<>(schemaPath);
                viewPath.add(entry.getKey());
                try {
                    var macro = ViewTable.viewMacro(schema, entry.getValue(), schemaPath, List.copyOf(viewPath), Boolean.FALSE);
                    macro.apply(Collections.emptyList());
                    schema.add(entry.getKey(), macro);
                } catch (RuntimeException ex) {
                    viewsRegistered = false;
                    throw new IllegalStateException(
                            "Failed to register view '" + entry.getKey() + "' with SQL:\n" + entry.getValue(), ex);
                }
            }
        }
    }

    private SchemaPlus resolveSchemaPlus() {
        SchemaPlus local = schemaPlus;
        if (local == null) {
            SchemaPlus resolved = parentSchema.getSubSchema(schemaName);
            if (resolved == null) {
                throw new IllegalStateException("Schema not registered yet: " + schemaName);
            }
            schemaPlus = resolved;
            local = resolved;
        }
        return local;
    }

    private static List<String> buildSchemaPath(SchemaPlus schema) {
        List<String> path = new ArrayList<>();
        SchemaPlus current = schema;
        while (current != null) {
            String name = current.getName();
            if (name != null && !name.isEmpty()) {
                path.add(0, name);
            }
            current = current.getParentSchema();
        }
        return List.copyOf(path);
    }

    private static Map<String, String> buildViewSql() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(MissingValuesView.NAME, MissingValuesView.sql());
        map.put(CandidateConflictsView.NAME, CandidateConflictsView.sql());
        return Collections.unmodifiableMap(map);
    }
}
