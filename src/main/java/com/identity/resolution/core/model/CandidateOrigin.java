package com.identity.resolution.core.model;

/**
 * How a candidate pair was produced.
 */
public enum CandidateOrigin {
    /** Both mentions share a non-empty blocking key. */
    BLOCK,
    /** Both mentions sit in the catch-all block of unblockable mentions. */
    LOW_CONFIDENCE_BLOCK,
    /** Cross-block nearest neighbour in embedding space. */
    EMBEDDING;

    /**
     * Lower rank wins when the same pair is produced by more than one route.
     */
    public int precedence() {
        return ordinal();
    }
}
