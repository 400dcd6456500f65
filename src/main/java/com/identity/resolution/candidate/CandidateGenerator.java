package com.identity.resolution.candidate;

import com.identity.resolution.blocking.BlockingIndex;
import com.identity.resolution.blocking.BlockingKeyStrategy;
import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.CandidatePair;
import com.identity.resolution.core.model.IdentityMention;
import com.identity.resolution.core.model.MentionPair;
import com.identity.resolution.logging.LogContext;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.similarity.CompositeSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Produces scored candidate pairs from the blocking index and the embedding index.
 *
 * <p>One task per block runs on the supplied worker pool; the cross-block embedding search runs
 * as one more concurrent task. Workers only read the immutable index and mentions. Results are
 * merged on the calling thread, keeping one pair per mention pair (block origin wins over
 * embedding origin).</p>
 */
public class CandidateGenerator {
    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    private static final Comparator<IdentityMention> WINDOW_ORDER =
            Comparator.comparing(IdentityMention::getComparisonName)
                    .thenComparing(IdentityMention::getMentionId);

    private final CompositeSimilarityScorer scorer;
    private final CandidateSettings settings;
    private final ExecutorService executor;
    private final MetricsService metricsService;

    public CandidateGenerator(CompositeSimilarityScorer scorer, CandidateSettings settings,
                              ExecutorService executor, MetricsService metricsService) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Generates and scores every candidate pair of a run.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers
     */
    public CandidateSet generate(String runId, BlockingIndex index, EmbeddingIndex embeddingIndex,
                                 Collection<IdentityMention> mentions) throws InterruptedException {
        List<String> oversized = new ArrayList<>();
        List<CompletableFuture<List<CandidatePair>>> tasks = new ArrayList<>();

        for (Map.Entry<String, List<IdentityMention>> block : index.blocks().entrySet()) {
            String key = block.getKey();
            List<IdentityMention> members = block.getValue();
            metricsService.recordBlockSize(members.size());
            if (countComparable(key, members) > settings.maxBlockSize()) {
                oversized.add(key);
                log.warn("block.oversized runId={} blockKey='{}' size={} maxBlockSize={}",
                        runId, key, members.size(), settings.maxBlockSize());
            }
            tasks.add(CompletableFuture.supplyAsync(() -> scoreBlock(runId, key, members), executor));
        }

        CompletableFuture<List<CandidatePair>> embeddingTask = settings.embeddingTopK() > 0 && embeddingIndex.size() > 1
                ? CompletableFuture.supplyAsync(() -> searchEmbeddings(runId, embeddingIndex, mentions), executor)
                : CompletableFuture.completedFuture(List.of());
        tasks.add(embeddingTask);

        Map<MentionPair, CandidatePair> merged = new TreeMap<>();
        for (CompletableFuture<List<CandidatePair>> task : tasks) {
            for (CandidatePair pair : await(task, tasks)) {
                merged.merge(pair.pair(), pair, CandidateGenerator::preferStrongerOrigin);
            }
        }

        CandidateSet result = new CandidateSet(new ArrayList<>(merged.values()), oversized, index.blockCount());
        log.info("candidates.generated runId={} blocks={} pairs={} block={} lowConfidence={} embedding={} oversizedBlocks={}",
                runId, result.blockCount(), result.size(),
                result.count(CandidateOrigin.BLOCK),
                result.count(CandidateOrigin.LOW_CONFIDENCE_BLOCK),
                result.count(CandidateOrigin.EMBEDDING),
                oversized.size());
        return result;
    }

    List<CandidatePair> scoreBlock(String runId, String key, List<IdentityMention> members) {
        try (LogContext ctx = LogContext.forBlock(runId, key)) {
            boolean catchAll = BlockingKeyStrategy.UNBLOCKABLE.equals(key);
            CandidateOrigin origin = catchAll ? CandidateOrigin.LOW_CONFIDENCE_BLOCK : CandidateOrigin.BLOCK;

            List<IdentityMention> comparable = new ArrayList<>(members.size());
            for (IdentityMention m : members) {
                // Parse failures are never paired: they are not identities.
                if (!catchAll || !m.isParseFailure()) {
                    comparable.add(m);
                }
            }

            List<CandidatePair> pairs = new ArrayList<>();
            if (comparable.size() <= settings.maxBlockSize()) {
                for (int i = 0; i < comparable.size(); i++) {
                    for (int j = i + 1; j < comparable.size(); j++) {
                        pairs.add(scoreOrdered(comparable.get(i), comparable.get(j), origin));
                    }
                }
            } else {
                comparable.sort(WINDOW_ORDER);
                int window = settings.maxBlockSize() - 1;
                for (int i = 0; i < comparable.size(); i++) {
                    int end = Math.min(comparable.size(), i + window + 1);
                    for (int j = i + 1; j < end; j++) {
                        pairs.add(scoreOrdered(comparable.get(i), comparable.get(j), origin));
                    }
                }
            }
            log.debug("block.scored blockKey='{}' members={} pairs={}", key, comparable.size(), pairs.size());
            return pairs;
        }
    }

    List<CandidatePair> searchEmbeddings(String runId, EmbeddingIndex embeddingIndex,
                                         Collection<IdentityMention> mentions) {
        try (LogContext ctx = LogContext.forBlock(runId, "<embedding>")) {
            Map<String, IdentityMention> byId = new HashMap<>();
            for (IdentityMention m : mentions) {
                byId.put(m.getMentionId(), m);
            }

            Map<MentionPair, CandidatePair> pairs = new TreeMap<>();
            List<IdentityMention> sources = new ArrayList<>(mentions);
            sources.sort(Comparator.comparing(IdentityMention::getMentionId));
            for (IdentityMention source : sources) {
                if (!source.hasEmbedding() || source.getParseConfidence() < settings.embeddingConfidenceFloor()) {
                    continue;
                }
                for (EmbeddingIndex.Neighbour neighbour : embeddingIndex.nearest(
                        source, settings.embeddingTopK(), settings.embeddingMinSimilarity())) {
                    IdentityMention other = byId.get(neighbour.mentionId());
                    if (other == null) {
                        continue;
                    }
                    MentionPair key = MentionPair.of(source.getMentionId(), other.getMentionId());
                    if (!pairs.containsKey(key)) {
                        pairs.put(key, scoreOrdered(source, other, CandidateOrigin.EMBEDDING));
                    }
                }
            }
            log.debug("embedding.searched sources={} pairs={}", sources.size(), pairs.size());
            return new ArrayList<>(pairs.values());
        }
    }

    private CandidatePair scoreOrdered(IdentityMention x, IdentityMention y, CandidateOrigin origin) {
        CandidatePair pair = x.getMentionId().compareTo(y.getMentionId()) <= 0
                ? scorer.score(x, y, origin)
                : scorer.score(y, x, origin);
        metricsService.recordSimilarityScore(pair.compositeScore());
        return pair;
    }

    private static CandidatePair preferStrongerOrigin(CandidatePair existing, CandidatePair incoming) {
        return incoming.origin().precedence() < existing.origin().precedence() ? incoming : existing;
    }

    private static int countComparable(String key, List<IdentityMention> members) {
        if (!BlockingKeyStrategy.UNBLOCKABLE.equals(key)) {
            return members.size();
        }
        int n = 0;
        for (IdentityMention m : members) {
            if (!m.isParseFailure()) {
                n++;
            }
        }
        return n;
    }

    private static List<CandidatePair> await(CompletableFuture<List<CandidatePair>> task,
                                             List<CompletableFuture<List<CandidatePair>>> all)
            throws InterruptedException {
        try {
            return task.get();
        } catch (InterruptedException e) {
            all.forEach(t -> t.cancel(true));
            throw e;
        } catch (ExecutionException e) {
            all.forEach(t -> t.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Candidate generation task failed", cause);
        }
    }
}
