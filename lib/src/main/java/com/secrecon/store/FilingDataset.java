package com.secrecon.store;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/** One loaded dataset: the four regulator tables behind their store interfaces. */
public final class FilingDataset {
    private final InMemoryFactStore facts;
    private final InMemoryPresentationStore presentation;
    private final TagLabelLookup tags;
    private final SubmissionIndex submissions;

    public FilingDataset(
            InMemoryFactStore facts,
            InMemoryPresentationStore presentation,
            TagLabelLookup tags,
            SubmissionIndex submissions) {
        this.facts = Objects.requireNonNull(facts, "facts");
        this.presentation = Objects.requireNonNull(presentation, "presentation");
        this.tags = Objects.requireNonNull(tags, "tags");
        this.submissions = Objects.requireNonNull(submissions, "submissions");
    }

    public InMemoryFactStore getFacts() {
        return facts;
    }

    public InMemoryPresentationStore getPresentation() {
        return presentation;
    }

    public TagLabelLookup getTags() {
        return tags;
    }

    public SubmissionIndex getSubmissions() {
        return submissions;
    }

    /** Every filing id seen in any table, in sorted order. */
    public Set<String> filingIds() {
        Set<String> ids = new TreeSet<>();
        ids.addAll(facts.filingIds());
        ids.addAll(presentation.filingIds());
        submissions.all().forEach(record -> ids.add(record.getFilingId()));
        return ids;
    }
}
