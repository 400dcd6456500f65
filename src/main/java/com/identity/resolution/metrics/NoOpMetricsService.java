package com.identity.resolution.metrics;

import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.SuppressionReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. Used as the default when no registry is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(String outcome, Duration duration) {
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void incrementEdgeDecision(EdgeDecision decision) {
    }

    @Override
    public void incrementSkippedMention(String category) {
    }

    @Override
    public void incrementSuppressedEntity(SuppressionReason reason) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordBlockSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
