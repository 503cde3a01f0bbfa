package com.secrecon.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One reconstructed statement line: the presentation row it came from, the value resolved for it
 * and the candidate diagnostics gathered while resolving. A row without a resolvable fact is still
 * produced, with {@link #hasValue()} false.
 */
public final class StatementRow {
    private final PresentationRow presentation;
    private final BigDecimal value;
    private final BigDecimal displayValue;
    private final String formattedValue;
    private final String unit;
    private final LocalDate endDate;
    private final Integer duration;
    private final String segments;
    private final String coreg;
    private final int candidateCount;
    private final int candidateUniqueValues;

    public StatementRow(
            PresentationRow presentation,
            BigDecimal value,
            BigDecimal displayValue,
            String formattedValue,
            String unit,
            LocalDate endDate,
            Integer duration,
            String segments,
            String coreg,
            int candidateCount,
            int candidateUniqueValues) {
        this.presentation = Objects.requireNonNull(presentation, "presentation");
        this.value = value;
        this.displayValue = displayValue;
        this.formattedValue = formattedValue;
        this.unit = unit;
        this.endDate = endDate;
        this.duration = duration;
        this.segments = segments;
        this.coreg = coreg;
        this.candidateCount = candidateCount;
        this.candidateUniqueValues = candidateUniqueValues;
    }

    public PresentationRow getPresentation() {
        return presentation;
    }

    public String getFilingId() {
        return presentation.getFilingId();
    }

    public StatementCode getStatement() {
        return presentation.getStatement();
    }

    public int getReport() {
        return presentation.getReport();
    }

    public int getLine() {
        return presentation.getLine();
    }

    public int getDepth() {
        return presentation.getDepth();
    }

    public String getSourceFile() {
        return presentation.getSourceFile();
    }

    public String getTag() {
        return presentation.getTag();
    }

    public String getVersion() {
        return presentation.getVersion();
    }

    public String getLabel() {
        return presentation.getDisplayLabel();
    }

    public boolean isNegating() {
        return presentation.isNegating();
    }

    /** Raw value of the selected fact, before any sign convention. */
    public BigDecimal getValue() {
        return value;
    }

    /** Value after the statement's sign convention. */
    public BigDecimal getDisplayValue() {
        return displayValue;
    }

    public String getFormattedValue() {
        return formattedValue;
    }

    public String getUnit() {
        return unit;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public Integer getDuration() {
        return duration;
    }

    public String getSegments() {
        return segments;
    }

    public String getCoreg() {
        return coreg;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public int getCandidateUniqueValues() {
        return candidateUniqueValues;
    }

    /** True when the surviving candidates disagree in value. */
    public boolean isConflict() {
        return candidateUniqueValues > 1;
    }

    public boolean hasValue() {
        return value != null;
    }

    /** Context actually used for this row. */
    public ResolvedContext getContext() {
        return ResolvedContext.of(endDate, duration);
    }
}
