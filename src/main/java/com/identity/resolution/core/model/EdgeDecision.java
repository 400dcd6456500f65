package com.identity.resolution.core.model;

/**
 * Outcome of classifying one candidate pair.
 */
public enum EdgeDecision {
    /** Score at or above the effective high threshold. */
    AUTO_MERGE,
    /** Score between the thresholds; routed to manual review and never unioned. */
    REVIEW,
    /** Score below the low threshold. */
    NO_MATCH,
    /** Merge approved by a reviewer. */
    FORCED_MERGE,
    /** Automatic merge skipped because it would join a pair a reviewer rejected. */
    BLOCKED_BY_OVERRIDE;

    public boolean isMerge() {
        return this == AUTO_MERGE || this == FORCED_MERGE;
    }
}
