package com.secrecon.model;

import java.util.Objects;

/** Concept metadata from the tag table ({@code tag.txt}). */
public final class TagRecord {
    private final String tag;
    private final String version;
    private final boolean custom;
    private final boolean abstractConcept;
    private final String datatype;
    private final String balanceType;
    private final String label;
    private final String documentation;

    public TagRecord(
            String tag,
            String version,
            boolean custom,
            boolean abstractConcept,
            String datatype,
            String balanceType,
            String label,
            String documentation) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.version = version;
        this.custom = custom;
        this.abstractConcept = abstractConcept;
        this.datatype = datatype;
        this.balanceType = balanceType;
        this.label = label;
        this.documentation = documentation;
    }

    public String getTag() {
        return tag;
    }

    public String getVersion() {
        return version;
    }

    public boolean isCustom() {
        return custom;
    }

    public boolean isAbstract() {
        return abstractConcept;
    }

    public String getDatatype() {
        return datatype;
    }

    /** {@code D} for debit, {@code C} for credit, {@code null} when not declared. */
    public String getBalanceType() {
        return balanceType;
    }

    public String getLabel() {
        return label;
    }

    public String getDocumentation() {
        return documentation;
    }
}
