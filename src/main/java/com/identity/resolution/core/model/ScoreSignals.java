package com.identity.resolution.core.model;

/**
 * Breakdown of the signals behind a composite score.
 *
 * @param phonetic     1.0 when both blocking keys are equal and non-empty, else 0.0
 * @param edit         normalized edit similarity of the comparison names
 * @param cosine       embedding cosine mapped to [0,1], or {@code null} when unavailable
 * @param typeConflict true when the two mentions carry different known types
 * @param capApplied   true when the composite was lowered by a cap
 */
public record ScoreSignals(
        double phonetic,
        double edit,
        Double cosine,
        boolean typeConflict,
        boolean capApplied
) {
    public boolean hasCosine() {
        return cosine != null;
    }

    @Override
    public String toString() {
        return String.format(
                "ScoreSignals{phonetic=%.4f, edit=%.4f, cosine=%s, typeConflict=%s, capApplied=%s}",
                phonetic, edit, cosine != null ? String.format("%.4f", cosine) : "n/a",
                typeConflict, capApplied);
    }
}
