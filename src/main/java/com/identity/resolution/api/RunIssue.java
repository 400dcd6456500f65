package com.identity.resolution.api;

/**
 * Categories of non-fatal issues collected during a run.
 */
public enum RunIssue {
    MISSING_MENTION_ID(true),
    MISSING_RAW_NAME(true),
    MISSING_SOURCE_REFERENCE(true),
    DUPLICATE_MENTION_ID(true),
    INVALID_RAW_NAME(true),
    PARSE_FAILURE(false),
    PLACEHOLDER_IDENTITY(false),
    REVIEW_QUEUED(false),
    OVERSIZED_BLOCK(false),
    EMBEDDING_DIMENSION_MISMATCH(false),
    BLOCKED_BY_OVERRIDE(false);

    private final boolean skipsMention;

    RunIssue(boolean skipsMention) {
        this.skipsMention = skipsMention;
    }

    /**
     * Whether a mention with this issue is left out of the run.
     */
    public boolean skipsMention() {
        return skipsMention;
    }

    public String metricTag() {
        return name().toLowerCase();
    }
}
