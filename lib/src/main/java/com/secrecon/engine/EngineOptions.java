package com.secrecon.engine;

import com.secrecon.model.StatementCode;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/** Tunables of the reconstruction engine. */
public final class EngineOptions {
    public static final String SUBTOTAL_TOLERANCE = "secrecon.subtotalTolerance";
    public static final String BATCH_PARALLELISM = "secrecon.batchParallelism";
    public static final String STATEMENT_CODES = "secrecon.statementCodes";

    static final BigDecimal DEFAULT_TOLERANCE = BigDecimal.ONE;

    private final BigDecimal subtotalTolerance;
    private final int batchParallelism;
    private final List<StatementCode> statementCodes;

    public EngineOptions(BigDecimal subtotalTolerance, int batchParallelism, List<StatementCode> statementCodes) {
        Objects.requireNonNull(subtotalTolerance, SUBTOTAL_TOLERANCE);
        Objects.requireNonNull(statementCodes, STATEMENT_CODES);
        if (subtotalTolerance.signum() < 0) {
            throw new IllegalArgumentException(SUBTOTAL_TOLERANCE + " must not be negative: " + subtotalTolerance);
        }
        if (batchParallelism < 1) {
            throw new IllegalArgumentException(BATCH_PARALLELISM + " must be at least 1: " + batchParallelism);
        }
        if (statementCodes.isEmpty()) {
            throw new IllegalArgumentException(STATEMENT_CODES + " must name at least one statement");
        }
        this.subtotalTolerance = subtotalTolerance;
        this.batchParallelism = batchParallelism;
        this.statementCodes = List.copyOf(statementCodes);
    }

    public static EngineOptions defaults() {
        return new EngineOptions(
                DEFAULT_TOLERANCE, Runtime.getRuntime().availableProcessors(), StatementCode.CORE);
    }

    /**
     * Reads options from properties; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException when a value cannot be parsed or is out of range
     */
    public static EngineOptions fromProperties(Properties properties) {
        EngineOptions defaults = defaults();
        if (properties == null) {
            return defaults;
        }
        BigDecimal tolerance = defaults.subtotalTolerance;
        String toleranceText = trimmed(properties.getProperty(SUBTOTAL_TOLERANCE));
        if (toleranceText != null) {
            try {
                tolerance = new BigDecimal(toleranceText);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + SUBTOTAL_TOLERANCE + ": " + toleranceText, e);
            }
        }
        int parallelism = defaults.batchParallelism;
        String parallelismText = trimmed(properties.getProperty(BATCH_PARALLELISM));
        if (parallelismText != null) {
            try {
                parallelism = Integer.parseInt(parallelismText);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + BATCH_PARALLELISM + ": " + parallelismText, e);
            }
        }
        List<StatementCode> codes = defaults.statementCodes;
        String codesText = trimmed(properties.getProperty(STATEMENT_CODES));
        if (codesText != null) {
            try {
                codes = StatementCode.parseList(codesText);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid " + STATEMENT_CODES + ": " + e.getMessage(), e);
            }
        }
        return new EngineOptions(tolerance, parallelism, codes);
    }

    private static String trimmed(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public BigDecimal getSubtotalTolerance() {
        return subtotalTolerance;
    }

    public int getBatchParallelism() {
        return batchParallelism;
    }

    /** Statement codes used when a caller names none. */
    public List<StatementCode> getStatementCodes() {
        return statementCodes;
    }

    @Override
    public String toString() {
        return "EngineOptions{tolerance="
                + subtotalTolerance
                + ", parallelism="
                + batchParallelism
                + ", statements="
                + statementCodes
                + "}";
    }
}
