package com.identity.resolution.metrics;

import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.SuppressionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code identity.run.duration} - Timer (tag: outcome)</li>
 *   <li>{@code identity.stage.duration} - Timer (tag: stage)</li>
 *   <li>{@code identity.edge.decision} - Counter (tag: decision)</li>
 *   <li>{@code identity.mention.skipped} - Counter (tag: category)</li>
 *   <li>{@code identity.entity.suppressed} - Counter (tag: reason)</li>
 *   <li>{@code identity.similarity.score} - DistributionSummary</li>
 *   <li>{@code identity.block.size} - DistributionSummary</li>
 *   <li>{@code identity.parse.cache.hit} / {@code identity.parse.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary blockSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("identity.similarity.score")
                .description("Distribution of composite similarity scores")
                .register(registry);
        this.blockSizeSummary = DistributionSummary.builder("identity.block.size")
                .description("Distribution of blocking-index block sizes")
                .register(registry);
        this.cacheHitCounter = Counter.builder("identity.parse.cache.hit")
                .description("Number of parse cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("identity.parse.cache.miss")
                .description("Number of parse cache misses")
                .register(registry);
    }

    @Override
    public void recordRunDuration(String outcome, Duration duration) {
        timer("identity.run.duration", "outcome", outcome, "Duration of resolution runs").record(duration);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        timer("identity.stage.duration", "stage", stage, "Duration of pipeline stages").record(duration);
    }

    @Override
    public void incrementEdgeDecision(EdgeDecision decision) {
        counter("identity.edge.decision", "decision", decision.name(), "Classified candidate edges").increment();
    }

    @Override
    public void incrementSkippedMention(String category) {
        counter("identity.mention.skipped", "category", category, "Mentions skipped during ingestion").increment();
    }

    @Override
    public void incrementSuppressedEntity(SuppressionReason reason) {
        counter("identity.entity.suppressed", "reason", reason.name(), "Entities suppressed from public view").increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordBlockSize(int size) {
        blockSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Timer timer(String name, String tagKey, String tagValue, String description) {
        return timerCache.computeIfAbsent(name + ":" + tagValue, k ->
                Timer.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
