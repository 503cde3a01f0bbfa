package com.secrecon.select;

import com.secrecon.model.NumericFact;
import java.util.Optional;

/** Outcome of selecting a fact for one row, with the candidate diagnostics behind it. */
public final class FactSelection {

    private static final FactSelection NONE = new FactSelection(null, 0, 0);

    private final NumericFact chosen;
    private final int candidateCount;
    private final int uniqueValues;

    FactSelection(NumericFact chosen, int candidateCount, int uniqueValues) {
        this.chosen = chosen;
        this.candidateCount = candidateCount;
        this.uniqueValues = uniqueValues;
    }

    public static FactSelection none() {
        return NONE;
    }

    public Optional<NumericFact> getChosen() {
        return Optional.ofNullable(chosen);
    }

    /** Facts still matching at the final narrowing stage. */
    public int getCandidateCount() {
        return candidateCount;
    }

    /** Distinct values among those facts, compared numerically. */
    public int getUniqueValues() {
        return uniqueValues;
    }

    public boolean isConflict() {
        return uniqueValues > 1;
    }

    @Override
    public String toString() {
        return "FactSelection{chosen="
                + (chosen == null ? "none" : chosen.getTag() + "=" + chosen.getValue())
                + ", candidates="
                + candidateCount
                + ", unique="
                + uniqueValues
                + "}";
    }
}
