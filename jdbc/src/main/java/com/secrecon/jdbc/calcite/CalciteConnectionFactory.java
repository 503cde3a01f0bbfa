package com.secrecon.jdbc.calcite;

import com.secrecon.engine.EngineOptions;
import com.secrecon.store.FilingDataset;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

/** Opens Calcite connections pre-wired with the dataset schema as the default schema. */
public final class CalciteConnectionFactory {
    public static final String SCHEMA_NAME = "sec";

    private CalciteConnectionFactory() {}

    public static Connection connect(Path datasetPath, Properties properties) throws SQLException {
        return connect(datasetPath, null, properties);
    }

    /**
     * @param dataset an already loaded snapshot of {@code datasetPath}, or {@code null} to load it
     *     when the schema is first queried
     * @throws SQLException when the engine options in {@code properties} are invalid
     */
    public static Connection connect(Path datasetPath, FilingDataset dataset, Properties properties)
            throws SQLException {
        Objects.requireNonNull(datasetPath, "datasetPath");
        Properties calciteProps = new Properties();
        if (properties != null) {
            calciteProps.putAll(properties);
        }
        setDefault(calciteProps, "lex", "JAVA");
        setDefault(calciteProps, "quoting", "DOUBLE_QUOTE");
        setDefault(calciteProps, "quotedCasing", "UNCHANGED");
        setDefault(calciteProps, "unquotedCasing", "UNCHANGED");
        setDefault(calciteProps, "caseSensitive", "true");
        setDefault(calciteProps, "conformance", "BABEL");

        EngineOptions options = engineOptions(calciteProps);
        Connection connection = DriverManager.getConnection("jdbc:calcite:", calciteProps);
        try {
            CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
            SchemaPlus root = calcite.getRootSchema();
            SecReconSchema schema =
                    new SecReconSchema(root, SCHEMA_NAME, datasetPath.toAbsolutePath().normalize(), dataset, options);
            root.add(SCHEMA_NAME, schema);
            calcite.setSchema(SCHEMA_NAME);
            return connection;
        } catch (SQLException | RuntimeException ex) {
            connection.close();
            throw ex;
        }
    }

    private static EngineOptions engineOptions(Properties properties) throws SQLException {
        Map<String, Object> values = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            values.put(key, properties.getProperty(key));
        }
        try {
            return SecReconSchema.optionsFrom(values);
        } catch (IllegalArgumentException ex) {
            throw new SQLException(ex.getMessage(), ex);
        }
    }

    private static void setDefault(Properties properties, String key, String value) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, value);
        }
    }
}
