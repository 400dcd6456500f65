package com.identity.resolution.api;

import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.audit.AuditEntry;
import com.identity.resolution.audit.AuditRepository;
import com.identity.resolution.audit.AuditService;
import com.identity.resolution.audit.MergeDecisionLog;
import com.identity.resolution.audit.MergeDecisionRecord;
import com.identity.resolution.blocking.BlockingIndex;
import com.identity.resolution.blocking.BlockingKeyStrategies;
import com.identity.resolution.blocking.IdentityMentionFactory;
import com.identity.resolution.blocking.NameNormalizer;
import com.identity.resolution.cache.ParseCache;
import com.identity.resolution.candidate.BruteForceEmbeddingIndex;
import com.identity.resolution.candidate.CandidateGenerator;
import com.identity.resolution.candidate.CandidateSet;
import com.identity.resolution.candidate.EmbeddingIndex;
import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.CandidatePair;
import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.IdentityMention;
import com.identity.resolution.core.model.MentionPair;
import com.identity.resolution.core.model.MentionRecord;
import com.identity.resolution.core.model.ResolvedEntity;
import com.identity.resolution.core.model.SuppressionReason;
import com.identity.resolution.logging.LogContext;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.MicrometerMetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.parser.HeuristicNameParser;
import com.identity.resolution.parser.InputSanitizer;
import com.identity.resolution.parser.NameParser;
import com.identity.resolution.parser.NameParserAdapter;
import com.identity.resolution.resolution.ClassifiedEdge;
import com.identity.resolution.resolution.ClusteringResult;
import com.identity.resolution.resolution.EdgeClassifier;
import com.identity.resolution.resolution.ResolutionEngine;
import com.identity.resolution.resolution.ReviewOverrides;
import com.identity.resolution.review.InMemoryReviewQueue;
import com.identity.resolution.review.ReviewItem;
import com.identity.resolution.review.ReviewQueue;
import com.identity.resolution.review.ReviewService;
import com.identity.resolution.similarity.CompositeSimilarityScorer;
import com.identity.resolution.store.InMemoryMentionRepository;
import com.identity.resolution.store.InMemoryResolutionStore;
import com.identity.resolution.store.MentionRepository;
import com.identity.resolution.store.PublicProjection;
import com.identity.resolution.store.ResolutionSnapshot;
import com.identity.resolution.store.ResolutionStore;
import com.identity.resolution.suppression.InMemorySuppressionRegistry;
import com.identity.resolution.suppression.SuppressionPolicy;
import com.identity.resolution.suppression.SuppressionRegistry;
import com.identity.resolution.suppression.SuppressionService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the identity resolution library.
 *
 * <p>A run reads every mention, parses and keys it, generates and scores candidate pairs,
 * clusters them into entities and applies the suppression policy. Nothing is published until
 * the run commits: the decision log, audit entries, review items and suppression registry are
 * updated together and the new snapshot replaces the previous one in a single swap. A run that
 * fails leaves the previous snapshot in place and records only a RUN_ABORTED audit entry.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (IdentityResolver resolver = IdentityResolver.builder()
 *         .config(ResolutionConfig.defaults())
 *         .build()) {
 *     resolver.getMentionRepository().add(new MentionRecord("m-1", SourceReference.of("flight_logs", "17"), "Jeffrey Epstein"));
 *     ResolutionRunResult result = resolver.run();
 *     PublicProjection visible = resolver.publicProjection().orElseThrow();
 * }
 * </pre>
 */
public class IdentityResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final ResolutionConfig config;
    private final String configFingerprint;
    private final MentionRepository mentionRepository;
    private final ResolutionStore resolutionStore;
    private final SuppressionRegistry suppressionRegistry;
    private final AuditService auditService;
    private final MergeDecisionLog mergeDecisionLog;
    private final ReviewService reviewService;
    private final SuppressionService suppressionService;
    private final MetricsService metricsService;
    private final IdentityMentionFactory mentionFactory;
    private final CompositeSimilarityScorer scorer;
    private final CandidateGenerator candidateGenerator;
    private final ResolutionEngine resolutionEngine;
    private final SuppressionPolicy suppressionPolicy;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private IdentityResolver(Builder builder) {
        this.config = builder.config;
        this.configFingerprint = config.fingerprint();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        this.mentionRepository = builder.mentionRepository != null
                ? builder.mentionRepository : new InMemoryMentionRepository();
        this.resolutionStore = builder.resolutionStore != null
                ? builder.resolutionStore : new InMemoryResolutionStore();
        this.suppressionRegistry = builder.suppressionRegistry != null
                ? builder.suppressionRegistry : new InMemorySuppressionRegistry();
        this.mergeDecisionLog = builder.mergeDecisionLog != null
                ? builder.mergeDecisionLog : new MergeDecisionLog();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        ReviewQueue reviewQueue = builder.reviewQueue != null
                ? builder.reviewQueue : new InMemoryReviewQueue();
        this.reviewService = new ReviewService(reviewQueue, auditService);
        this.suppressionService = new SuppressionService(suppressionRegistry, auditService);

        NameParser nameParser = builder.nameParser != null ? builder.nameParser : new HeuristicNameParser();
        NameParserAdapter parserAdapter = new NameParserAdapter(nameParser,
                ParseCache.create(config.getParseCache()), metricsService);
        NameNormalizer normalizer = new NameNormalizer();
        this.mentionFactory = new IdentityMentionFactory(parserAdapter, normalizer,
                BlockingKeyStrategies.forVersion(config.getBlockingKeyVersion(), normalizer),
                config.placeholderMatcher());

        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newFixedThreadPool(config.getParallelism());
            this.ownsExecutor = true;
        }

        this.scorer = new CompositeSimilarityScorer(config.getWeights(), config.getEditAlgorithm(),
                config.getTypeConflictCap(), config.getLowConfidenceCap());
        this.candidateGenerator = new CandidateGenerator(scorer, config.toCandidateSettings(), executor, metricsService);
        this.resolutionEngine = new ResolutionEngine(new EdgeClassifier(config.getTLow(), config.getTHigh(),
                config.getCrossBlockAutoMergeThreshold()));
        this.suppressionPolicy = new SuppressionPolicy(config.placeholderMatcher(), suppressionRegistry,
                config.getKAnonymityK(), config.getKAnonymityConfidenceFloor());

        log.info("IdentityResolver initialized config={} fingerprint={}", config, configFingerprint);
    }

    // ========== Runs ==========

    /**
     * Resolves every mention currently in the mention repository.
     *
     * @throws DataIntegrityException      if the previous snapshot references mentions that are gone
     * @throws ResolutionAbortedException  if the run is interrupted or fails unexpectedly
     */
    public ResolutionRunResult run() {
        return run(mentionRepository.findAll());
    }

    /**
     * Resolves the given mention records. Records that fail validation are skipped and
     * reported; the rest are partitioned into entities.
     */
    public ResolutionRunResult run(Collection<MentionRecord> records) {
        String runId = LogContext.generateRunId();
        long startNanos = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("run.started runId={} records={} fingerprint={}", runId, records.size(), configFingerprint);
            try {
                ResolutionRunResult result = execute(runId, records, startNanos);
                metricsService.recordRunDuration("committed", result.duration());
                return result;
            } catch (DataIntegrityException e) {
                abort(runId, startNanos, e);
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abort(runId, startNanos, e);
                throw new ResolutionAbortedException(runId, "Run " + runId + " interrupted", e);
            } catch (RuntimeException e) {
                abort(runId, startNanos, e);
                throw new ResolutionAbortedException(runId, "Run " + runId + " failed: " + e.getMessage(), e);
            }
        }
    }

    private ResolutionRunResult execute(String runId, Collection<MentionRecord> records, long startNanos)
            throws InterruptedException {
        List<AuditEntry> pendingAudit = new ArrayList<>();
        pendingAudit.add(runEntry(AuditAction.RUN_STARTED, runId, Map.of(
                "records", records.size(),
                "configFingerprint", configFingerprint)));
        RunReport report = new RunReport(config.getReportExampleLimit());

        long stageStart = System.nanoTime();
        verifyPreviousSnapshot(records);
        List<IdentityMention> mentions = ingest(runId, records, report, pendingAudit);
        Map<String, IdentityMention> byId = new TreeMap<>();
        for (IdentityMention mention : mentions) {
            byId.put(mention.getMentionId(), mention);
        }
        stageDone("ingest", stageStart);

        stageStart = System.nanoTime();
        BlockingIndex blockingIndex = BlockingIndex.build(mentions);
        EmbeddingIndex embeddingIndex = new BruteForceEmbeddingIndex(mentions);
        stageDone("blocking", stageStart);
        log.info("blocking.completed runId={} blocks={} largestBlock={} catchAll={} embeddings={}",
                runId, blockingIndex.blockCount(), blockingIndex.largestBlockSize(),
                blockingIndex.catchAll().size(), embeddingIndex.size());

        stageStart = System.nanoTime();
        CandidateSet candidateSet = candidateGenerator.generate(runId, blockingIndex, embeddingIndex, mentions);
        for (String key : candidateSet.oversizedBlocks()) {
            report.add(RunIssue.OVERSIZED_BLOCK, key);
        }
        ReviewOverrides overrides = reviewService.currentOverrides();
        List<CandidatePair> candidates = withForcedPairs(candidateSet.pairs(), overrides, byId);
        stageDone("candidates", stageStart);

        stageStart = System.nanoTime();
        ClusteringResult clustering = resolutionEngine.resolve(mentions, candidates, overrides);
        stageDone("resolve", stageStart);

        stageStart = System.nanoTime();
        List<ResolvedEntity> entities = suppressionPolicy.apply(clustering.entities(), byId);
        stageDone("suppression", stageStart);

        stageStart = System.nanoTime();
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted before commit");
        }
        ResolutionRunResult result = commit(runId, startNanos, byId, candidates.size(), clustering, entities,
                report, pendingAudit);
        stageDone("commit", stageStart);
        return result;
    }

    private void verifyPreviousSnapshot(Collection<MentionRecord> records) {
        Optional<ResolutionSnapshot> previous = resolutionStore.current();
        if (previous.isEmpty()) {
            return;
        }
        Set<String> knownIds = new HashSet<>();
        for (MentionRecord record : records) {
            if (record.mentionId() != null) {
                knownIds.add(record.mentionId());
            }
        }
        Set<String> offending = new TreeSet<>();
        for (EntityMentionLink link : previous.get().getLinks()) {
            if (!knownIds.contains(link.mentionId())) {
                offending.add(link.entityId() + "/" + link.mentionId());
            }
        }
        if (!offending.isEmpty()) {
            throw new DataIntegrityException("Previous snapshot " + previous.get().getRunId()
                    + " links mentions missing from the repository", new ArrayList<>(offending));
        }
    }

    private List<IdentityMention> ingest(String runId, Collection<MentionRecord> records, RunReport report,
                                         List<AuditEntry> pendingAudit) {
        List<IdentityMention> mentions = new ArrayList<>(records.size());
        Set<String> seen = new HashSet<>();
        for (MentionRecord record : records) {
            RunIssue rejection = validate(record, seen);
            if (rejection != null) {
                String subject = record.mentionId() != null ? record.mentionId() : "<missing>";
                report.add(rejection, subject);
                metricsService.incrementSkippedMention(rejection.metricTag());
                pendingAudit.add(AuditEntry.builder()
                        .action(AuditAction.MENTION_REJECTED)
                        .subjectId(subject)
                        .actorId(AuditService.SYSTEM_ACTOR)
                        .runId(runId)
                        .details(Map.of("category", rejection.name()))
                        .build());
                log.warn("mention.skipped runId={} mentionId={} category={}", runId, subject, rejection);
                continue;
            }

            MentionRecord accepted = record;
            Integer dimension = config.getEmbeddingDimension();
            if (dimension != null && record.hasEmbedding() && record.embedding().length != dimension) {
                report.add(RunIssue.EMBEDDING_DIMENSION_MISMATCH, record.mentionId());
                log.debug("mention.embeddingDropped runId={} mentionId={} length={} expected={}",
                        runId, record.mentionId(), record.embedding().length, dimension);
                accepted = new MentionRecord(record.mentionId(), record.sourceReference(), record.rawName(),
                        record.hints(), null);
            }

            IdentityMention mention = mentionFactory.create(accepted);
            if (mentionFactory.isPlaceholder(mention.getRawName())) {
                report.add(RunIssue.PLACEHOLDER_IDENTITY, mention.getMentionId());
            } else if (mention.isParseFailure()) {
                report.add(RunIssue.PARSE_FAILURE, mention.getMentionId());
            }
            mentions.add(mention);
        }
        log.info("ingest.completed runId={} accepted={} skipped={}", runId, mentions.size(), report.skippedMentions());
        return mentions;
    }

    private static RunIssue validate(MentionRecord record, Set<String> seen) {
        if (record.mentionId() == null || record.mentionId().isBlank()) {
            return RunIssue.MISSING_MENTION_ID;
        }
        if (!seen.add(record.mentionId())) {
            return RunIssue.DUPLICATE_MENTION_ID;
        }
        if (record.rawName() == null || record.rawName().isBlank()) {
            return RunIssue.MISSING_RAW_NAME;
        }
        if (record.sourceReference() == null) {
            return RunIssue.MISSING_SOURCE_REFERENCE;
        }
        try {
            InputSanitizer.validateRawName(record.rawName());
        } catch (IllegalArgumentException e) {
            return RunIssue.INVALID_RAW_NAME;
        }
        return null;
    }

    /**
     * Approved review pairs that candidate generation did not produce are scored here, so every
     * forced merge is backed by a scored edge in the decision log.
     */
    private List<CandidatePair> withForcedPairs(List<CandidatePair> generated, ReviewOverrides overrides,
                                                Map<String, IdentityMention> byId) {
        if (overrides.getForcedMerges().isEmpty()) {
            return generated;
        }
        Set<MentionPair> present = new HashSet<>();
        for (CandidatePair pair : generated) {
            present.add(pair.pair());
        }
        List<CandidatePair> result = new ArrayList<>(generated);
        for (MentionPair pair : overrides.getForcedMerges()) {
            IdentityMention a = byId.get(pair.mentionIdA());
            IdentityMention b = byId.get(pair.mentionIdB());
            if (a == null || b == null || present.contains(pair)) {
                continue;
            }
            boolean sameBlock = !a.isUnblockable() && a.getBlockingKey().equals(b.getBlockingKey());
            result.add(scorer.score(a, b, sameBlock ? CandidateOrigin.BLOCK : CandidateOrigin.EMBEDDING));
        }
        return result;
    }

    private ResolutionRunResult commit(String runId, long startNanos, Map<String, IdentityMention> byId,
                                       int candidateCount, ClusteringResult clustering,
                                       List<ResolvedEntity> entities, RunReport report,
                                       List<AuditEntry> pendingAudit) {
        Instant now = Instant.now();

        // Suppression registry entries, written after the snapshot swap
        Map<String, Set<SuppressionReason>> reasonsByMention = new TreeMap<>();
        List<ResolvedEntity> suppressedEntities = new ArrayList<>();
        int newlySuppressed = 0;
        for (ResolvedEntity entity : entities) {
            if (!entity.isSuppressFromPublic()) {
                continue;
            }
            suppressedEntities.add(entity);
            boolean isNew = false;
            for (String mentionId : entity.getMemberMentionIds()) {
                reasonsByMention.put(mentionId, EnumSet.copyOf(entity.getSuppressionReasons()));
                if (!suppressionRegistry.isSuppressed(mentionId)) {
                    isNew = true;
                }
            }
            if (isNew) {
                newlySuppressed++;
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("reasons", entity.getSuppressionReasons().toString());
                details.put("members", entity.size());
                pendingAudit.add(AuditEntry.builder()
                        .action(AuditAction.ENTITY_SUPPRESSED)
                        .subjectId(entity.getEntityId())
                        .actorId(AuditService.SYSTEM_ACTOR)
                        .runId(runId)
                        .details(details)
                        .timestamp(now)
                        .build());
            }
        }

        // Decision records
        Map<EdgeDecision, Long> decisionCounts = new EnumMap<>(EdgeDecision.class);
        List<MergeDecisionRecord> decisions = new ArrayList<>(clustering.edges().size());
        for (ClassifiedEdge edge : clustering.edges()) {
            CandidatePair candidate = edge.candidate();
            decisions.add(MergeDecisionRecord.builder()
                    .runId(runId)
                    .pair(candidate.pair())
                    .origin(candidate.origin())
                    .compositeScore(candidate.compositeScore())
                    .signals(candidate.signals())
                    .outcome(edge.decision())
                    .thresholds(config.getTLow(), edge.effectiveHigh())
                    .blockingKeyVersion(config.getBlockingKeyVersion())
                    .embeddingModelId(config.getEmbeddingModelId())
                    .evaluatedAt(now)
                    .build());
            decisionCounts.merge(edge.decision(), 1L, Long::sum);
            if (edge.decision() == EdgeDecision.BLOCKED_BY_OVERRIDE) {
                report.add(RunIssue.BLOCKED_BY_OVERRIDE, candidate.pair().key());
            }
        }

        // Review items
        List<ReviewItem> reviewItems = new ArrayList<>(clustering.reviewPairs().size());
        for (CandidatePair pair : clustering.reviewPairs()) {
            report.add(RunIssue.REVIEW_QUEUED, pair.pair().key());
            reviewItems.add(ReviewItem.builder()
                    .pair(pair.pair())
                    .rawNameA(byId.get(pair.mentionIdA()).getRawName())
                    .rawNameB(byId.get(pair.mentionIdB()).getRawName())
                    .origin(pair.origin())
                    .similarityScore(pair.compositeScore())
                    .runId(runId)
                    .build());
        }

        // The snapshot swap is the commit point; nothing of this run is published before it succeeds.
        ResolutionSnapshot snapshot = new ResolutionSnapshot(runId, now, configFingerprint, entities,
                clustering.links());
        resolutionStore.commit(snapshot);

        suppressionRegistry.suppressAll(reasonsByMention, runId);
        mergeDecisionLog.appendAll(decisions);
        int submitted = 0;
        for (ReviewItem item : reviewItems) {
            AuditEntry requested = reviewService.submitForReview(item);
            if (requested != null) {
                pendingAudit.add(requested);
                submitted++;
            }
        }
        for (ResolvedEntity entity : suppressedEntities) {
            for (SuppressionReason reason : entity.getSuppressionReasons()) {
                metricsService.incrementSuppressedEntity(reason);
            }
        }
        for (ClassifiedEdge edge : clustering.edges()) {
            metricsService.incrementEdgeDecision(edge.decision());
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        Map<String, Object> committedDetails = new LinkedHashMap<>();
        committedDetails.put("entities", entities.size());
        committedDetails.put("mentions", byId.size());
        committedDetails.put("candidatePairs", candidateCount);
        committedDetails.put("reviewItemsSubmitted", submitted);
        committedDetails.put("newlySuppressed", newlySuppressed);
        committedDetails.put("durationMs", duration.toMillis());
        pendingAudit.add(runEntry(AuditAction.RUN_COMMITTED, runId, committedDetails));
        auditService.recordAll(pendingAudit);

        log.info("run.committed runId={} mentions={} entities={} candidates={} autoMerge={} review={} "
                        + "reviewSubmitted={} newlySuppressed={} skipped={} durationMs={}",
                runId, byId.size(), entities.size(), candidateCount,
                decisionCounts.getOrDefault(EdgeDecision.AUTO_MERGE, 0L),
                decisionCounts.getOrDefault(EdgeDecision.REVIEW, 0L),
                submitted, newlySuppressed, report.skippedMentions(), duration.toMillis());

        return new ResolutionRunResult(runId, snapshot, report, candidateCount, decisionCounts,
                submitted, newlySuppressed, duration);
    }

    private void abort(String runId, long startNanos, Exception cause) {
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        metricsService.recordRunDuration("aborted", duration);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", cause.getClass().getSimpleName());
        details.put("message", String.valueOf(cause.getMessage()));
        auditService.record(runEntry(AuditAction.RUN_ABORTED, runId, details));
        log.error("run.aborted runId={} error={} message={}", runId,
                cause.getClass().getSimpleName(), cause.getMessage(), cause);
    }

    private static AuditEntry runEntry(AuditAction action, String runId, Map<String, Object> details) {
        return AuditEntry.builder()
                .action(action)
                .subjectId(runId)
                .actorId(AuditService.SYSTEM_ACTOR)
                .runId(runId)
                .details(details)
                .build();
    }

    private void stageDone(String stage, long startNanos) {
        metricsService.recordStageDuration(stage, Duration.ofNanos(System.nanoTime() - startNanos));
    }

    // ========== Results ==========

    public Optional<ResolutionSnapshot> currentSnapshot() {
        return resolutionStore.current();
    }

    /**
     * Public view of the current snapshot, with suppressed and low-confidence singleton entities removed.
     */
    public Optional<PublicProjection> publicProjection() {
        return resolutionStore.current()
                .map(snapshot -> PublicProjection.of(snapshot, config.getPublicDisclosureFloor()));
    }

    // ========== Review & Suppression ==========

    /**
     * Approves a review item. The pair is merged by the next run.
     */
    public void approveReview(String reviewId, String reviewerId, String notes) {
        reviewService.approveMatch(reviewId, reviewerId, notes);
    }

    /**
     * Rejects a review item. The pair becomes a cannot-link constraint for subsequent runs.
     */
    public void rejectReview(String reviewId, String reviewerId, String notes) {
        reviewService.rejectMatch(reviewId, reviewerId, notes);
    }

    /**
     * Administrative override lifting a mention's suppression. Takes effect on the next run,
     * provided no suppression rule still applies.
     */
    public boolean liftSuppression(String mentionId, String adminId, String reason) {
        return suppressionService.liftSuppression(mentionId, adminId, reason);
    }

    // ========== Accessors ==========

    public ResolutionConfig getConfig() {
        return config;
    }

    public MentionRepository getMentionRepository() {
        return mentionRepository;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MergeDecisionLog getMergeDecisionLog() {
        return mergeDecisionLog;
    }

    public SuppressionRegistry getSuppressionRegistry() {
        return suppressionRegistry;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResolutionConfig config = ResolutionConfig.defaults();
        private NameParser nameParser;
        private MentionRepository mentionRepository;
        private ResolutionStore resolutionStore;
        private SuppressionRegistry suppressionRegistry;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MergeDecisionLog mergeDecisionLog;
        private ReviewQueue reviewQueue;
        private MetricsService metricsService;
        private ExecutorService executor;

        public Builder config(ResolutionConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        /**
         * Replaces the bundled heuristic parser, e.g. with an adapter over an external CRF parser.
         */
        public Builder nameParser(NameParser nameParser) {
            this.nameParser = nameParser;
            return this;
        }

        public Builder mentionRepository(MentionRepository mentionRepository) {
            this.mentionRepository = mentionRepository;
            return this;
        }

        public Builder resolutionStore(ResolutionStore resolutionStore) {
            this.resolutionStore = resolutionStore;
            return this;
        }

        public Builder suppressionRegistry(SuppressionRegistry suppressionRegistry) {
            this.suppressionRegistry = suppressionRegistry;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder mergeDecisionLog(MergeDecisionLog mergeDecisionLog) {
            this.mergeDecisionLog = mergeDecisionLog;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Convenience for {@code metricsService(new MicrometerMetricsService(registry))}.
         */
        public Builder meterRegistry(MeterRegistry registry) {
            this.metricsService = new MicrometerMetricsService(registry);
            return this;
        }

        /**
         * Worker pool for block scoring. When not set, the resolver owns a fixed pool of
         * {@code parallelism} threads and shuts it down on close.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public IdentityResolver build() {
            return new IdentityResolver(this);
        }
    }
}
