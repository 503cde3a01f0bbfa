package com.secrecon.jdbc;

import com.secrecon.engine.EngineOptions;
import com.secrecon.jdbc.calcite.CalciteConnectionFactory;
import com.secrecon.jdbc.dataset.DatasetProvider;
import com.secrecon.loader.LoaderException;
import com.secrecon.loader.LoaderMessage;
import com.secrecon.loader.LoaderResult;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.util.Arrays;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.calcite.schema.Schema;

/**
 * JDBC driver that opens Calcite-backed connections over an SEC financial statement dataset
 * directory.
 *
 * <p>URLs take the form {@code jdbc:secrecon:<directory>[?key=value&...]}. Query parameters are
 * passed on as connection properties, so engine options such as {@code secrecon.subtotalTolerance}
 * may be given either way.
 */
public final class SecReconDriver implements Driver {

    static final String URL_PREFIX = "jdbc:secrecon:";
    static final String WARNING_PREFIX = "[SEC Statements] ";
    private static final String METADATA_SCHEMA_NAME = "metadata";
    private static final String SYSTEM_TABLE_JDBC_NAME = Schema.TableType.SYSTEM_TABLE.jdbcName;
    private static final Logger LOGGER = Logger.getLogger(SecReconDriver.class.getName());

    static {
        try {
            DriverManager.registerDriver(new SecReconDriver());
        } catch (SQLException ex) {
            throw new ExceptionInInitializerError(ex);
        }
    }

    @Override
    public Connection connect(String url, Properties info) throws SQLException {
        if (!acceptsURL(url)) {
            return null;
        }
        ParsedUrl parsed = parseUrl(url);
        Properties properties = new Properties();
        if (info != null) {
            for (String key : info.stringPropertyNames()) {
                properties.setProperty(key, info.getProperty(key));
            }
        }
        properties.putAll(parsed.properties);
        properties.setProperty("dataset", parsed.datasetPath.toString());

        LoaderResult loaderResult;
        try {
            loaderResult = DatasetProvider.load(parsed.datasetPath);
        } catch (LoaderException ex) {
            throw new SQLException("Failed to load dataset: " + parsed.datasetPath, ex);
        }
        Connection connection =
                CalciteConnectionFactory.connect(parsed.datasetPath, loaderResult.getDataset(), properties);
        SQLWarning warnings = buildWarningChain(loaderResult);
        logWarnings(loaderResult);
        return wrapCalciteConnection(connection, warnings);
    }

    @Override
    public boolean acceptsURL(String url) {
        return url != null && url.startsWith(URL_PREFIX);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        DriverPropertyInfo datasetProperty = new DriverPropertyInfo("dataset", null);
        datasetProperty.required = true;
        datasetProperty.description = "Directory holding num.txt and pre.txt, plus optional tag.txt and sub.txt.";
        DriverPropertyInfo toleranceProperty =
                new DriverPropertyInfo(EngineOptions.SUBTOTAL_TOLERANCE, property(info, EngineOptions.SUBTOTAL_TOLERANCE));
        toleranceProperty.description = "Largest absolute subtotal difference that still passes.";
        DriverPropertyInfo parallelismProperty =
                new DriverPropertyInfo(EngineOptions.BATCH_PARALLELISM, property(info, EngineOptions.BATCH_PARALLELISM));
        parallelismProperty.description = "Worker threads used for batch validation.";
        DriverPropertyInfo codesProperty =
                new DriverPropertyInfo(
                        EngineOptions.STATEMENT_CODES, property(info, EngineOptions.STATEMENT_CODES));
        codesProperty.description = "Comma separated statement codes materialized into statement_rows.";
        return new DriverPropertyInfo[] {datasetProperty, toleranceProperty, parallelismProperty, codesProperty};
    }

    @Override
    public int getMajorVersion() {
        return Version.MAJOR;
    }

    @Override
    public int getMinorVersion() {
        return Version.MINOR;
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("Logging hierarchy not implemented.");
    }

    private static String property(Properties info, String key) {
        return info == null ? null : info.getProperty(key);
    }

    static ParsedUrl parseUrl(String url) throws SQLException {
        String remainder = url.substring(URL_PREFIX.length());
        if (remainder.isEmpty()) {
            throw new SQLException("Dataset directory missing from JDBC URL.");
        }

        String datasetSegment = remainder;
        Properties props = new Properties();
        int paramIndex = remainder.indexOf('?');
        if (paramIndex >= 0) {
            datasetSegment = remainder.substring(0, paramIndex);
            String query = remainder.substring(paramIndex + 1);
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                if (eq >= 0) {
                    props.setProperty(pair.substring(0, eq), pair.substring(eq + 1));
                } else {
                    props.setProperty(pair, "");
                }
            }
        }

        Path datasetPath;
        if (datasetSegment.startsWith("file:")) {
            try {
                datasetPath = Paths.get(java.net.URI.create(datasetSegment));
            } catch (IllegalArgumentException ex) {
                throw new SQLException("Invalid file URI in JDBC URL: " + datasetSegment, ex);
            }
        } else {
            datasetPath = Paths.get(datasetSegment);
        }
        datasetPath = datasetPath.normalize();

        if (!Files.isDirectory(datasetPath)) {
            throw new SQLException("Dataset directory not found: " + datasetPath);
        }
        if (!Files.isReadable(datasetPath)) {
            throw new SQLException("Dataset directory is not readable: " + datasetPath);
        }
        return new ParsedUrl(datasetPath.toAbsolutePath(), props);
    }

    private Connection wrapCalciteConnection(Connection delegate, SQLWarning warnings) {
        return (Connection)
                Proxy.newProxyInstance(
                        Connection.class.getClassLoader(),
                        new Class<?>[] {Connection.class},
                        new DelegatingHandler(delegate) {
                            private SQLWarning localWarnings = warnings;

                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                if ("getMetaData".equals(method.getName()) && args == null) {
                                    DatabaseMetaData meta = (DatabaseMetaData) invokeDelegate(method, null);
                                    return wrapCalciteMetaData(meta);
                                } else if ("getWarnings".equals(method.getName())) {
                                    return localWarnings;
                                } else if ("clearWarnings".equals(method.getName())) {
                                    localWarnings = null;
                                    return null;
                                }
                                return super.handle(proxy, method, args);
                            }
                        });
    }

    static SQLWarning buildWarningChain(LoaderResult loaderResult) {
        if (loaderResult == null) {
            return null;
        }
        SQLWarning head = null;
        SQLWarning tail = null;
        for (LoaderMessage message : loaderResult.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.WARNING) {
                continue;
            }
            SQLWarning warning = new SQLWarning(WARNING_PREFIX + message.getMessage() + location(message));
            if (head == null) {
                head = warning;
            } else {
                tail.setNextWarning(warning);
            }
            tail = warning;
        }
        return head;
    }

    private static void logWarnings(LoaderResult loaderResult) {
        for (LoaderMessage message : loaderResult.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.WARNING) {
                continue;
            }
            LOGGER.log(Level.WARNING, WARNING_PREFIX + "{0}{1}", new Object[] {message.getMessage(), location(message)});
        }
    }

    private static String location(LoaderMessage message) {
        if (message.getSourceFilename() == null) {
            return "";
        }
        String location = message.getSourceFilename();
        if (message.getSourceLineno() > 0) {
            location = location + ":" + message.getSourceLineno();
        }
        return " (" + location + ")";
    }

    private DatabaseMetaData wrapCalciteMetaData(DatabaseMetaData delegate) {
        return (DatabaseMetaData)
                Proxy.newProxyInstance(
                        DatabaseMetaData.class.getClassLoader(),
                        new Class<?>[] {DatabaseMetaData.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getDatabaseProductName" -> "SEC Statements";
                                    case "getDatabaseProductVersion", "getDriverVersion" -> Version.RUNTIME;
                                    case "getDriverName" -> "SEC Statements JDBC Driver (Calcite)";
                                    case "getDriverMajorVersion" -> Version.MAJOR;
                                    case "getDriverMinorVersion" -> Version.MINOR;
                                    case "getTables" -> invokeDelegate(method, adjustMetadataTableArgs(args));
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    record ParsedUrl(Path datasetPath, Properties properties) {}

    private abstract static class DelegatingHandler implements InvocationHandler {
        private final Object delegate;

        DelegatingHandler(Object delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return method.invoke(delegate, args);
            }
            return handle(proxy, method, args);
        }

        Object handle(Object proxy, Method method, Object[] args) throws Throwable {
            return invokeDelegate(method, args);
        }

        final Object invokeDelegate(Method method, Object[] args) throws Throwable {
            try {
                return method.invoke(delegate, args);
            } catch (InvocationTargetException ex) {
                throw ex.getCause();
            }
        }
    }

    private static Object[] adjustMetadataTableArgs(Object[] args) {
        if (args == null || args.length < 4) {
            return args;
        }
        if (!metadataSchemaRequested(args[1])) {
            return args;
        }
        String[] requestedTypes = (String[]) args[3];
        if (requestedTypes == null) {
            return args;
        }
        String[] augmentedTypes = includeSystemTableType(requestedTypes);
        if (augmentedTypes == requestedTypes) {
            return args;
        }
        Object[] adjusted = args.clone();
        adjusted[3] = augmentedTypes;
        return adjusted;
    }

    private static boolean metadataSchemaRequested(Object schemaPattern) {
        if (schemaPattern == null) {
            return true;
        }
        if (!(schemaPattern instanceof String pattern)) {
            return false;
        }
        String normalized = pattern.trim();
        if (normalized.isEmpty() || "%".equals(normalized)) {
            return true;
        }
        if (normalized.startsWith("\"") && normalized.endsWith("\"") && normalized.length() > 1) {
            normalized = normalized.substring(1, normalized.length() - 1);
        }
        return METADATA_SCHEMA_NAME.equalsIgnoreCase(normalized);
    }

    private static String[] includeSystemTableType(String[] requestedTypes) {
        for (String type : requestedTypes) {
            if (type != null && SYSTEM_TABLE_JDBC_NAME.equalsIgnoreCase(type.trim())) {
                return requestedTypes;
            }
        }
        String[] augmented = Arrays.copyOf(requestedTypes, requestedTypes.length + 1);
        augmented[requestedTypes.length] = SYSTEM_TABLE_JDBC_NAME;
        return augmented;
    }
}
