package com.identity.resolution.similarity;

/**
 * Selectable edit-similarity measures.
 */
public enum EditAlgorithm {
    LEVENSHTEIN,
    JARO_WINKLER;

    public SimilarityAlgorithm create() {
        return this == JARO_WINKLER ? new JaroWinklerSimilarity() : new LevenshteinSimilarity();
    }
}
