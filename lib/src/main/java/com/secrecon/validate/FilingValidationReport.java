package com.secrecon.validate;

import com.secrecon.model.StatementCode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Per-statement diagnostics and the summary of one filing. */
public final class FilingValidationReport {
    private final String filingId;
    private final Map<StatementCode, StatementDiagnostics> statements;
    private final FilingSummary summary;

    public FilingValidationReport(String filingId, Map<StatementCode, StatementDiagnostics> statements) {
        this.filingId = Objects.requireNonNull(filingId, "filingId");
        this.statements = Collections.unmodifiableMap(new LinkedHashMap<>(statements));
        this.summary = FilingSummary.of(this.statements.values());
    }

    public String getFilingId() {
        return filingId;
    }

    /** Diagnostics per statement code, in the order the codes were requested. */
    public Map<StatementCode, StatementDiagnostics> getStatements() {
        return statements;
    }

    public StatementDiagnostics getStatement(StatementCode code) {
        return statements.get(code);
    }

    public FilingSummary getSummary() {
        return summary;
    }

    public ValidationStatus getStatus() {
        return summary.getStatus();
    }
}
