package com.secrecon.validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Validation reports of many filings and their status tally. */
public final class BatchValidationReport {
    private final Map<String, FilingValidationReport> results;
    private final StatusTally statusCounts;

    public BatchValidationReport(Map<String, FilingValidationReport> results, StatusTally statusCounts) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(results, "results")));
        this.statusCounts = Objects.requireNonNull(statusCounts, "statusCounts");
        if (statusCounts.total() != results.size()) {
            throw new IllegalArgumentException(
                    "Tally of " + statusCounts.total() + " does not match " + results.size() + " results");
        }
    }

    public int getCount() {
        return results.size();
    }

    public StatusTally getStatusCounts() {
        return statusCounts;
    }

    /** Reports keyed by filing id, in request order. */
    public Map<String, FilingValidationReport> getResults() {
        return results;
    }
}
