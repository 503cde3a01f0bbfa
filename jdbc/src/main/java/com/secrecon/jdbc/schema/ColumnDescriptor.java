package com.secrecon.jdbc.schema;

import java.math.BigDecimal;
import java.sql.Types;
import java.util.Objects;

public final class ColumnDescriptor {
    static final int DECIMAL_PRECISION = 28;
    static final int DECIMAL_SCALE = 6;

    private final String name;
    private final int jdbcType;
    private final String typeName;
    private final int size;
    private final int scale;
    private final boolean nullable;
    private final String className;

    public ColumnDescriptor(
            String name,
            int jdbcType,
            String typeName,
            int size,
            int scale,
            boolean nullable,
            String className) {
        this.name = Objects.requireNonNull(name, "name");
        this.jdbcType = jdbcType;
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.size = size;
        this.scale = scale;
        this.nullable = nullable;
        this.className = Objects.requireNonNull(className, "className");
    }

    static ColumnDescriptor varchar(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.VARCHAR, "VARCHAR", 0, 0, nullable, String.class.getName());
    }

    static ColumnDescriptor integer(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.INTEGER, "INTEGER", 10, 0, nullable, Integer.class.getName());
    }

    static ColumnDescriptor decimal(String name) {
        return new ColumnDescriptor(
                name,
                Types.DECIMAL,
                "DECIMAL(" + DECIMAL_PRECISION + "," + DECIMAL_SCALE + ")",
                DECIMAL_PRECISION,
                DECIMAL_SCALE,
                true,
                BigDecimal.class.getName());
    }

    static ColumnDescriptor doubleColumn(String name) {
        return new ColumnDescriptor(name, Types.DOUBLE, "DOUBLE", 0, 0, false, Double.class.getName());
    }

    static ColumnDescriptor bool(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.BOOLEAN, "BOOLEAN", 0, 0, nullable, Boolean.class.getName());
    }

    /** Dates are carried as days since the epoch, the representation Calcite scans. */
    static ColumnDescriptor date(String name) {
        return new ColumnDescriptor(name, Types.DATE, "DATE", 0, 0, true, java.sql.Date.class.getName());
    }

    public String getName() {
        return name;
    }

    public int getJdbcType() {
        return jdbcType;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getSize() {
        return size;
    }

    public int getScale() {
        return scale;
    }

    public boolean isNullable() {
        return nullable;
    }

    public String getClassName() {
        return className;
    }
}
