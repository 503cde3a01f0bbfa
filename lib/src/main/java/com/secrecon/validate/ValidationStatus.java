package com.secrecon.validate;

import java.util.Locale;

/** Tri-state health of a filing reconstruction. */
public enum ValidationStatus {
    PASS,
    WARN,
    FAIL;

    /** Lower-case name used in reports and SQL results. */
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
