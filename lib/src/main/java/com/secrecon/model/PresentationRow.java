package com.secrecon.model;

import java.util.Comparator;
import java.util.Objects;

/** One line of a rendered statement from the presentation table ({@code pre.txt}). */
public final class PresentationRow {

    /** Regulator display order: report group, then line number. */
    public static final Comparator<PresentationRow> DISPLAY_ORDER =
            Comparator.comparingInt(PresentationRow::getReport).thenComparingInt(PresentationRow::getLine);

    private final String filingId;
    private final StatementCode statement;
    private final int report;
    private final int line;
    private final int depth;
    private final String sourceFile;
    private final String tag;
    private final String version;
    private final String label;
    private final boolean negating;

    public PresentationRow(
            String filingId,
            StatementCode statement,
            int report,
            int line,
            int depth,
            String sourceFile,
            String tag,
            String version,
            String label,
            boolean negating) {
        this.filingId = Objects.requireNonNull(filingId, "filingId");
        this.statement = Objects.requireNonNull(statement, "statement");
        this.tag = Objects.requireNonNull(tag, "tag");
        this.report = report;
        this.line = line;
        this.depth = Math.max(0, depth);
        this.sourceFile = sourceFile;
        this.version = version;
        this.label = label;
        this.negating = negating;
    }

    public String getFilingId() {
        return filingId;
    }

    public StatementCode getStatement() {
        return statement;
    }

    public int getReport() {
        return report;
    }

    public int getLine() {
        return line;
    }

    public int getDepth() {
        return depth;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public String getTag() {
        return tag;
    }

    public String getVersion() {
        return version;
    }

    public String getLabel() {
        return label;
    }

    /** Label to display: the presentation label, or the tag when the filer gave none. */
    public String getDisplayLabel() {
        return label == null || label.isBlank() ? tag : label;
    }

    public boolean isNegating() {
        return negating;
    }
}
