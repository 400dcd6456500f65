package com.identity.resolution.candidate;

/**
 * Tuning knobs of candidate generation.
 *
 * @param maxBlockSize             blocks above this size are sampled with a sliding window
 * @param embeddingTopK            neighbours retrieved per embedding query; 0 disables cross-block search
 * @param embeddingConfidenceFloor minimum parse confidence of a mention that issues an embedding query
 * @param embeddingMinSimilarity   minimum raw cosine similarity of a retrieved neighbour
 */
public record CandidateSettings(
        int maxBlockSize,
        int embeddingTopK,
        double embeddingConfidenceFloor,
        double embeddingMinSimilarity
) {
    public CandidateSettings {
        if (maxBlockSize < 2) {
            throw new IllegalArgumentException("maxBlockSize must be >= 2");
        }
        if (embeddingTopK < 0) {
            throw new IllegalArgumentException("embeddingTopK must be >= 0");
        }
    }

    public static CandidateSettings defaults() {
        return new CandidateSettings(500, 5, 0.5, 0.80);
    }
}
