package com.secrecon.store;

import com.secrecon.model.SubmissionRecord;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Lookup and sampling over the submission index. */
public final class SubmissionIndex {

    private static final Comparator<SubmissionRecord> NEWEST_FIRST =
            Comparator.comparing(
                            SubmissionRecord::getFiled,
                            Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
                    .thenComparing(SubmissionRecord::getFilingId);

    private final Map<String, SubmissionRecord> byFilingId;

    public SubmissionIndex(Collection<SubmissionRecord> records) {
        Objects.requireNonNull(records, "records");
        Map<String, SubmissionRecord> map = new LinkedHashMap<>();
        for (SubmissionRecord record : records) {
            map.putIfAbsent(record.getFilingId(), record);
        }
        this.byFilingId = map;
    }

    public static SubmissionIndex empty() {
        return new SubmissionIndex(List.of());
    }

    public Optional<SubmissionRecord> find(String filingId) {
        return Optional.ofNullable(byFilingId.get(filingId));
    }

    public List<SubmissionRecord> filingsForCompany(String cik) {
        List<SubmissionRecord> filings = new ArrayList<>();
        for (SubmissionRecord record : byFilingId.values()) {
            if (Objects.equals(cik, record.getCik())) {
                filings.add(record);
            }
        }
        return filings;
    }

    public List<SubmissionRecord> all() {
        return List.copyOf(byFilingId.values());
    }

    public int size() {
        return byFilingId.size();
    }

    /**
     * Picks filing ids for a batch run: newest filed first, ties by filing id.
     *
     * @param limit maximum number of ids returned
     * @param forms form types to keep (case-insensitive); empty keeps all forms
     * @param uniqueCik keep at most one filing per company
     */
    public List<String> sample(int limit, Collection<String> forms, boolean uniqueCik) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        Set<String> formSet = new HashSet<>();
        for (String form : forms) {
            if (form != null && !form.isBlank()) {
                formSet.add(form.trim().toUpperCase(Locale.ROOT));
            }
        }
        List<SubmissionRecord> candidates = new ArrayList<>();
        for (SubmissionRecord record : byFilingId.values()) {
            String form = record.getForm() == null ? "" : record.getForm().toUpperCase(Locale.ROOT);
            if (formSet.isEmpty() || formSet.contains(form)) {
                candidates.add(record);
            }
        }
        candidates.sort(NEWEST_FIRST);
        Set<String> seenCiks = new HashSet<>();
        List<String> sample = new ArrayList<>();
        for (SubmissionRecord record : candidates) {
            if (sample.size() >= limit) {
                break;
            }
            if (uniqueCik && record.getCik() != null && !seenCiks.add(record.getCik())) {
                continue;
            }
            sample.add(record.getFilingId());
        }
        return sample;
    }
}
