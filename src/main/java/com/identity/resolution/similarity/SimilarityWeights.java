package com.identity.resolution.similarity;

/**
 * Weights of the composite score signals. Must be non-negative and sum to 1.
 */
public record SimilarityWeights(
        double phoneticWeight,
        double editWeight,
        double embeddingWeight
) {
    private static final double TOLERANCE = 0.001;

    public SimilarityWeights {
        if (phoneticWeight < 0 || editWeight < 0 || embeddingWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = phoneticWeight + editWeight + embeddingWeight;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: edit similarity dominates, phonetic agreement and embedding share the rest.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.25, 0.50, 0.25);
    }

    /**
     * Sum of the weights of the signals that are present; the cosine weight only counts when
     * both mentions carry comparable embeddings.
     */
    public double presentWeight(boolean cosinePresent) {
        return phoneticWeight + editWeight + (cosinePresent ? embeddingWeight : 0.0);
    }
}
