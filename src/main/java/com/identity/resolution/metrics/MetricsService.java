package com.identity.resolution.metrics;

import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.SuppressionReason;

import java.time.Duration;

/**
 * Interface for recording resolution-run metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    /**
     * @param outcome {@code committed} or {@code aborted}
     */
    void recordRunDuration(String outcome, Duration duration);

    void recordStageDuration(String stage, Duration duration);

    void incrementEdgeDecision(EdgeDecision decision);

    void incrementSkippedMention(String category);

    void incrementSuppressedEntity(SuppressionReason reason);

    void recordSimilarityScore(double score);

    void recordBlockSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
