package com.secrecon.jdbc.schema;

import java.time.LocalDate;

/** Conversions from model values to the representations Calcite scans. */
final class SqlValues {

    private SqlValues() {}

    static Integer epochDay(LocalDate date) {
        return date == null ? null : Math.toIntExact(date.toEpochDay());
    }

    static String code(Object value) {
        return value == null ? null : value.toString();
    }
}
