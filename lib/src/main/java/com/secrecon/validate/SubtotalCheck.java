package com.secrecon.validate;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One arithmetic identity evaluated over a reconstructed statement. A check whose inputs are
 * missing is not applicable and never counts as a failure.
 */
public final class SubtotalCheck {
    private final String name;
    private final boolean applicable;
    private final boolean passed;
    private final BigDecimal left;
    private final BigDecimal right;
    private final BigDecimal delta;
    private final BigDecimal tolerance;
    private final String variant;

    private SubtotalCheck(
            String name,
            boolean applicable,
            boolean passed,
            BigDecimal left,
            BigDecimal right,
            BigDecimal delta,
            BigDecimal tolerance,
            String variant) {
        this.name = Objects.requireNonNull(name, "name");
        this.applicable = applicable;
        this.passed = passed;
        this.left = left;
        this.right = right;
        this.delta = delta;
        this.tolerance = tolerance;
        this.variant = variant;
    }

    public static SubtotalCheck notApplicable(String name) {
        return new SubtotalCheck(name, false, true, null, null, null, null, null);
    }

    /** Compares {@code left} with {@code right} within {@code tolerance}. */
    public static SubtotalCheck compare(
            String name, BigDecimal left, BigDecimal right, BigDecimal tolerance, String variant) {
        BigDecimal delta = left.subtract(right);
        boolean passed = delta.abs().compareTo(tolerance) <= 0;
        return new SubtotalCheck(name, true, passed, left, right, delta, tolerance, passed ? variant : null);
    }

    public String getName() {
        return name;
    }

    public boolean isApplicable() {
        return applicable;
    }

    public boolean isPassed() {
        return passed;
    }

    public boolean isFailed() {
        return applicable && !passed;
    }

    public BigDecimal getLeft() {
        return left;
    }

    public BigDecimal getRight() {
        return right;
    }

    /** {@code left - right}, or {@code null} when not applicable. */
    public BigDecimal getDelta() {
        return delta;
    }

    public BigDecimal getTolerance() {
        return tolerance;
    }

    /** Formula variant that passed, or {@code null}. */
    public String getVariant() {
        return variant;
    }

    @Override
    public String toString() {
        if (!applicable) {
            return name + ": not applicable";
        }
        return name + ": " + (passed ? "pass" : "fail") + " delta=" + delta + (variant == null ? "" : " via " + variant);
    }
}
