package com.identity.resolution.suppression;

import com.identity.resolution.core.model.SuppressionReason;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Registry row: a mention that has been withheld from public projections.
 *
 * @param firstRunId run that first suppressed the mention
 * @param reasons    reasons recorded when the mention was first suppressed
 */
public record SuppressionRecord(String mentionId, String firstRunId, Set<SuppressionReason> reasons, Instant suppressedAt) {

    public SuppressionRecord {
        Objects.requireNonNull(mentionId, "mentionId is required");
        Objects.requireNonNull(suppressedAt, "suppressedAt is required");
        reasons = reasons != null ? Set.copyOf(reasons) : Set.of();
    }
}
