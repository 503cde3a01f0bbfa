package com.secrecon.resolve;

import com.secrecon.model.NumericFact;
import com.secrecon.model.ResolvedContext;
import com.secrecon.model.SubmissionRecord;
import com.secrecon.store.FactStore;
import com.secrecon.store.SubmissionIndex;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Short reporting-period label for a filing: {@code FY-2024} for a fiscal year, {@code Q3-2024}
 * for one to three quarters, {@code P6-2024} for any other span.
 */
public final class FilingPeriod {
    private final FactStore facts;
    private final SubmissionIndex submissions;
    private final ContextResolver resolver = new ContextResolver();

    public FilingPeriod(FactStore facts, SubmissionIndex submissions) {
        this.facts = Objects.requireNonNull(facts, "facts");
        this.submissions = Objects.requireNonNull(submissions, "submissions");
    }

    /**
     * Labels the filing from its latest duration context. Only consolidated facts are looked at
     * when the filing has any, so a filing whose consolidated facts are all instants gets the
     * filed year even if a segment or co-registrant reports a duration. Without any duration fact
     * the filed year is used; without that too the label is absent.
     */
    public Optional<String> describe(String filingId) {
        Objects.requireNonNull(filingId, "filingId");
        List<NumericFact> scope = primaryOrAll(facts.factsFor(filingId));
        ResolvedContext latest = resolver.latestPeriod(scope).getContext();
        if (latest.getEndDate() == null) {
            return submissions
                    .find(filingId)
                    .map(SubmissionRecord::getFiled)
                    .map(filed -> "FY-" + filed.getYear());
        }
        return Optional.of(label(latest.getEndDate(), latest.getDuration()));
    }

    private static List<NumericFact> primaryOrAll(List<NumericFact> filingFacts) {
        List<NumericFact> primary = new ArrayList<>();
        for (NumericFact fact : filingFacts) {
            if (fact.isPrimary()) {
                primary.add(fact);
            }
        }
        return primary.isEmpty() ? filingFacts : primary;
    }

    static String label(LocalDate endDate, Integer quarters) {
        int year = endDate.getYear();
        if (quarters == null || quarters == 4) {
            return "FY-" + year;
        }
        if (quarters >= 1 && quarters <= 3) {
            return "Q" + quarters + "-" + year;
        }
        return "P" + quarters + "-" + year;
    }
}
