package com.secrecon.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One row of the numeric fact table ({@code num.txt}). Fields that could not be parsed upstream are
 * carried as {@code null}; such facts never become selection candidates.
 *
 * <p>{@code duration} counts quarters: {@code 0} is an instant balance, anything greater is an
 * accumulation over the period ending at {@code endDate}.</p>
 */
public final class NumericFact {
    private final String filingId;
    private final String tag;
    private final String version;
    private final LocalDate endDate;
    private final Integer duration;
    private final String unit;
    private final String coreg;
    private final String segments;
    private final BigDecimal value;

    public NumericFact(
            String filingId,
            String tag,
            String version,
            LocalDate endDate,
            Integer duration,
            String unit,
            String coreg,
            String segments,
            BigDecimal value) {
        this.filingId = Objects.requireNonNull(filingId, "filingId");
        this.tag = Objects.requireNonNull(tag, "tag");
        if (duration != null && duration < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + duration);
        }
        this.version = version;
        this.endDate = endDate;
        this.duration = duration;
        this.unit = unit;
        this.coreg = coreg;
        this.segments = segments;
        this.value = value;
    }

    public String getFilingId() {
        return filingId;
    }

    public String getTag() {
        return tag;
    }

    public String getVersion() {
        return version;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public Integer getDuration() {
        return duration;
    }

    public String getUnit() {
        return unit;
    }

    public String getCoreg() {
        return coreg;
    }

    public String getSegments() {
        return segments;
    }

    public BigDecimal getValue() {
        return value;
    }

    public boolean isInstant() {
        return duration != null && duration == 0;
    }

    public boolean isPeriod() {
        return duration != null && duration > 0;
    }

    public boolean hasCoreg() {
        return coreg != null && !coreg.isEmpty();
    }

    public boolean hasSegments() {
        return segments != null && !segments.isEmpty();
    }

    /** Consolidated total: neither a co-registrant nor a segment breakdown. */
    public boolean isPrimary() {
        return !hasCoreg() && !hasSegments();
    }
}
