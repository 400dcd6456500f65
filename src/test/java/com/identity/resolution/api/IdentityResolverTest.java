package com.identity.resolution.api;

import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.MentionHints;
import com.identity.resolution.core.model.MentionRecord;
import com.identity.resolution.core.model.ParseType;
import com.identity.resolution.core.model.ResolvedEntity;
import com.identity.resolution.core.model.SourceReference;
import com.identity.resolution.core.model.SuppressionReason;
import com.identity.resolution.parser.NameParser;
import com.identity.resolution.resolution.ResolutionEngine;
import com.identity.resolution.review.ReviewItem;
import com.identity.resolution.store.PublicProjection;
import com.identity.resolution.store.ResolutionStore;
import com.identity.resolution.store.ResolutionSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.identity.resolution.MentionFixtures.protectedRecord;
import static com.identity.resolution.MentionFixtures.record;
import static org.junit.jupiter.api.Assertions.*;

class IdentityResolverTest {

    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = newResolver(ResolutionConfig.builder().parallelism(2).build());
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    private static IdentityResolver newResolver(ResolutionConfig config) {
        return IdentityResolver.builder().config(config).build();
    }

    private static ResolvedEntity entityOf(ResolutionRunResult result, String mentionId) {
        return result.snapshot().findEntityForMention(mentionId)
                .orElseThrow(() -> new AssertionError("No entity for " + mentionId));
    }

    private ReviewItem onlyPendingReview() {
        List<ReviewItem> pending = resolver.getReviewService().getPendingReviews(PageRequest.first(10)).content();
        assertEquals(1, pending.size());
        return pending.get(0);
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Exact duplicates auto-merge into one verified entity")
        void testExactDuplicatesMerge() {
            ResolutionRunResult result = resolver.run(List.of(
                    record("m1", "Jeffrey Epstein"),
                    record("m2", "Jeffrey Epstein")));

            assertEquals(1, result.entities().size());
            ResolvedEntity entity = result.entities().get(0);
            assertTrue(entity.isVerified());
            assertEquals(Set.of("m1", "m2"), entity.getMemberMentionIds());
            assertEquals(ResolutionEngine.entityIdFor("m1"), entity.getEntityId());
            assertEquals(1L, result.count(EdgeDecision.AUTO_MERGE));
            assertFalse(entity.isSuppressFromPublic());
        }

        @Test
        @DisplayName("A near match is queued for review and left unmerged")
        void testNearMatchQueuedForReview() {
            ResolutionRunResult result = resolver.run(List.of(
                    record("m1", "Jon Smith"),
                    record("m2", "John Smyth")));

            assertEquals(2, result.entities().size());
            assertEquals(1L, result.count(EdgeDecision.REVIEW));
            assertEquals(1, result.reviewItemsSubmitted());
            assertEquals(1, result.report().count(RunIssue.REVIEW_QUEUED));

            ReviewItem item = onlyPendingReview();
            assertEquals("m1", item.getMentionIdA());
            assertEquals("m2", item.getMentionIdB());
            assertEquals("Jon Smith", item.getRawNameA());
            assertEquals(result.runId(), item.getRunId());
        }

        @Test
        @DisplayName("A person and a declared organization with the same name never merge")
        void testTypeConflictNeverMerges() {
            float[] embedding = {0.6f, 0.8f, 0.0f};
            ResolutionRunResult result = resolver.run(List.of(
                    record("m1", "Maria Farmer", embedding),
                    new MentionRecord("m2", SourceReference.of("contacts", "m2"), "Maria Farmer",
                            MentionHints.declared(ParseType.ORGANIZATION), embedding)));

            assertEquals(2, result.entities().size());
            assertEquals(0L, result.count(EdgeDecision.AUTO_MERGE));
            assertEquals(0L, result.count(EdgeDecision.REVIEW));
        }

        @Test
        @DisplayName("Every decision of the run lands in the merge decision log")
        void testDecisionsLogged() {
            ResolutionRunResult result = resolver.run(List.of(
                    record("m1", "Jeffrey Epstein"),
                    record("m2", "Jeffrey Epstein"),
                    record("m3", "Jon Smith"),
                    record("m4", "John Smyth")));

            assertEquals(result.candidatePairs(), resolver.getMergeDecisionLog().getRecordsForRun(result.runId()).size());
        }
    }

    @Nested
    @DisplayName("Partition properties")
    class PartitionProperties {

        private final List<MentionRecord> corpus = List.of(
                record("m1", "Jeffrey Epstein"),
                record("m2", "Jeffrey Epstein"),
                record("m3", "J. Epstein"),
                record("m4", "Jon Smith"),
                record("m5", "John Smyth"),
                record("m6", "Acme Holdings LLC"),
                record("m7", "?"),
                protectedRecord("m8", "Virginia Roberts"));

        @Test
        @DisplayName("Every mention is linked to exactly one entity")
        void testEveryMentionLinkedOnce() {
            ResolutionRunResult result = resolver.run(corpus);

            List<EntityMentionLink> links = result.snapshot().getLinks();
            assertEquals(corpus.size(), links.size());
            Set<String> linked = links.stream().map(EntityMentionLink::mentionId).collect(Collectors.toSet());
            assertEquals(corpus.size(), linked.size());

            Set<String> members = new HashSet<>();
            for (ResolvedEntity entity : result.entities()) {
                for (String id : entity.getMemberMentionIds()) {
                    assertTrue(members.add(id), "mention in two entities: " + id);
                }
            }
            assertEquals(linked, members);
        }

        @Test
        @DisplayName("Two resolvers produce the same entity ids for the same input")
        void testDeterministicAcrossResolvers() {
            ResolutionRunResult first = resolver.run(corpus);
            try (IdentityResolver other = newResolver(ResolutionConfig.builder().parallelism(4).build())) {
                ResolutionRunResult second = other.run(corpus);

                assertEquals(first.snapshot().getLinks(), second.snapshot().getLinks());
                assertEquals(first.snapshot().getConfigFingerprint(), second.snapshot().getConfigFingerprint());
            }
        }

        @Test
        @DisplayName("Re-running the same input keeps the partition and queues no duplicate reviews")
        void testIdempotentRerun() {
            ResolutionRunResult first = resolver.run(corpus);
            long pending = resolver.getReviewService().getPendingCount();

            ResolutionRunResult second = resolver.run(corpus);

            assertEquals(first.snapshot().getLinks(), second.snapshot().getLinks());
            assertEquals(0, second.reviewItemsSubmitted());
            assertEquals(0, second.newlySuppressed());
            assertEquals(pending, resolver.getReviewService().getPendingCount());
        }
    }

    @Nested
    @DisplayName("Review overrides")
    class ReviewOverridesOnRerun {

        private final List<MentionRecord> pair = List.of(record("m1", "Jon Smith"), record("m2", "John Smyth"));

        @Test
        @DisplayName("An approved review merges the pair on the next run")
        void testApprovedReviewForcesMerge() {
            resolver.run(pair);
            resolver.approveReview(onlyPendingReview().getId(), "analyst-1", "same person");

            ResolutionRunResult result = resolver.run(pair);

            assertEquals(1, result.entities().size());
            assertEquals(1L, result.count(EdgeDecision.FORCED_MERGE));
            assertEquals(0, result.reviewItemsSubmitted());
        }

        @Test
        @DisplayName("A rejected review blocks the pair on the next run")
        void testRejectedReviewBlocksPair() {
            resolver.run(pair);
            resolver.rejectReview(onlyPendingReview().getId(), "analyst-1", "different people");

            ResolutionRunResult result = resolver.run(pair);

            assertEquals(2, result.entities().size());
            assertEquals(1L, result.count(EdgeDecision.BLOCKED_BY_OVERRIDE));
            assertEquals(1, result.report().count(RunIssue.BLOCKED_BY_OVERRIDE));
            assertEquals(0, resolver.getReviewService().getPendingCount());
        }

        @Test
        @DisplayName("Review decisions are audited")
        void testReviewDecisionsAudited() {
            resolver.run(pair);
            resolver.approveReview(onlyPendingReview().getId(), "analyst-1", "same person");

            assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.REVIEW_REQUESTED).size());
            assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.REVIEW_APPROVED).size());
        }
    }

    @Nested
    @DisplayName("Suppression")
    class Suppression {

        @Test
        @DisplayName("A protected marker suppresses the whole merged entity")
        void testProtectedMarkerSuppressesEntity() {
            ResolutionRunResult result = resolver.run(List.of(
                    protectedRecord("m1", "Virginia Roberts"),
                    record("m2", "Virginia Roberts"),
                    record("m3", "Jeffrey Epstein")));

            ResolvedEntity protectedEntity = entityOf(result, "m2");
            assertEquals(Set.of("m1", "m2"), protectedEntity.getMemberMentionIds());
            assertTrue(protectedEntity.getSuppressionReasons().contains(SuppressionReason.PROTECTED_MARKER));
            assertEquals(1, result.newlySuppressed());

            PublicProjection projection = resolver.publicProjection().orElseThrow();
            assertFalse(projection.isVisible(protectedEntity.getEntityId()));
            assertTrue(projection.isVisible(entityOf(result, "m3").getEntityId()));
            assertTrue(projection.getLinks().stream().noneMatch(l -> l.mentionId().equals("m1")));
            assertTrue(resolver.getSuppressionRegistry().isSuppressed("m2"));
        }

        @Test
        @DisplayName("Suppression persists after the marker disappears")
        void testSuppressionIsMonotonic() {
            resolver.run(List.of(protectedRecord("m1", "Virginia Roberts"), record("m2", "Virginia Roberts")));

            ResolutionRunResult second = resolver.run(List.of(
                    record("m1", "Virginia Roberts"), record("m2", "Virginia Roberts")));

            ResolvedEntity entity = entityOf(second, "m1");
            assertTrue(entity.isSuppressFromPublic());
            assertEquals(Set.of(SuppressionReason.PREVIOUSLY_SUPPRESSED), entity.getSuppressionReasons());
            assertEquals(0, second.newlySuppressed());
        }

        @Test
        @DisplayName("Lifting a suppression takes effect on the next run")
        void testLiftSuppression() {
            resolver.run(List.of(protectedRecord("m1", "Virginia Roberts"), record("m2", "Virginia Roberts")));

            assertTrue(resolver.liftSuppression("m1", "admin-1", "marker withdrawn upstream"));
            assertTrue(resolver.liftSuppression("m2", "admin-1", "marker withdrawn upstream"));
            assertFalse(resolver.liftSuppression("m3", "admin-1", "unknown mention"));

            ResolutionRunResult result = resolver.run(List.of(
                    record("m1", "Virginia Roberts"), record("m2", "Virginia Roberts")));

            assertFalse(entityOf(result, "m1").isSuppressFromPublic());
            assertEquals(3, resolver.getAuditService().getEntriesByAction(AuditAction.SUPPRESSION_LIFTED).size(),
                    "every lift request is audited, including misses");
        }

        @Test
        @DisplayName("A rare low-confidence partial identity is suppressed by k-anonymity")
        void testKAnonymity() {
            ResolutionRunResult result = resolver.run(List.of(
                    record("m1", "Jeffrey Epstein"),
                    record("m2", "J. Epstein")));

            assertEquals(2, result.entities().size());
            assertTrue(entityOf(result, "m2").getSuppressionReasons().contains(SuppressionReason.K_ANONYMITY));
            assertFalse(entityOf(result, "m1").isSuppressFromPublic());
        }

        @Test
        @DisplayName("A placeholder name is suppressed and reported")
        void testPlaceholderSuppressed() {
            ResolutionRunResult result = resolver.run(List.of(record("m1", "Jane Doe")));

            assertTrue(entityOf(result, "m1").getSuppressionReasons().contains(SuppressionReason.PLACEHOLDER_IDENTITY));
            assertEquals(1, result.report().count(RunIssue.PLACEHOLDER_IDENTITY));
        }

        @Test
        @DisplayName("An unparseable name stays a singleton hidden from the public view but not suppressed")
        void testUnparseableName() {
            ResolutionRunResult result = resolver.run(List.of(record("m1", "?"), record("m2", "?")));

            assertEquals(2, result.entities().size());
            ResolvedEntity entity = entityOf(result, "m1");
            assertEquals(0.0, entity.getBestParseConfidence());
            assertFalse(entity.isSuppressFromPublic());
            assertEquals(2, result.report().count(RunIssue.PARSE_FAILURE));
            assertFalse(resolver.publicProjection().orElseThrow().isVisible(entity.getEntityId()));
        }
    }

    @Nested
    @DisplayName("Ingestion")
    class Ingestion {

        @Test
        @DisplayName("Incomplete records are skipped, reported and audited")
        void testSkippedMentions() {
            ResolutionRunResult result = resolver.run(List.of(
                    record("m1", "Jeffrey Epstein"),
                    record("m1", "Ghislaine Maxwell"),
                    record("m2", "  "),
                    new MentionRecord("m3", null, "Maria Farmer"),
                    new MentionRecord(null, null, "Nobody")));

            RunReport report = result.report();
            assertEquals(1, report.count(RunIssue.DUPLICATE_MENTION_ID));
            assertEquals(1, report.count(RunIssue.MISSING_RAW_NAME));
            assertEquals(1, report.count(RunIssue.MISSING_SOURCE_REFERENCE));
            assertEquals(1, report.count(RunIssue.MISSING_MENTION_ID));
            assertEquals(List.of("m3"), report.examples(RunIssue.MISSING_SOURCE_REFERENCE));
            assertEquals(4, report.skippedMentions());
            assertEquals(1, result.snapshot().mentionCount());
            assertEquals(4, resolver.getAuditService().getEntriesByAction(AuditAction.MENTION_REJECTED).size());
        }

        @Test
        @DisplayName("An embedding of the wrong dimension is dropped and reported")
        void testEmbeddingDimensionMismatch() {
            try (IdentityResolver strict = newResolver(ResolutionConfig.builder()
                    .embeddingDimension(3).parallelism(1).build())) {
                ResolutionRunResult result = strict.run(List.of(
                        record("m1", "Maria Farmer", new float[]{0.1f, 0.2f}),
                        record("m2", "Ghislaine Maxwell", new float[]{0.1f, 0.2f, 0.3f})));

                assertEquals(1, result.report().count(RunIssue.EMBEDDING_DIMENSION_MISMATCH));
                assertEquals(List.of("m1"), result.report().examples(RunIssue.EMBEDDING_DIMENSION_MISMATCH));
                assertEquals(2, result.snapshot().mentionCount());
            }
        }

        @Test
        @DisplayName("run() without arguments resolves the mention repository")
        void testRunFromRepository() {
            resolver.getMentionRepository().addAll(List.of(
                    record("m1", "Jeffrey Epstein"), record("m2", "Jeffrey Epstein")));

            ResolutionRunResult result = resolver.run();

            assertEquals(1, result.entities().size());
        }
    }

    @Nested
    @DisplayName("Run lifecycle")
    class RunLifecycle {

        @Test
        @DisplayName("Committed runs are bracketed by start and commit audit entries")
        void testRunAudited() {
            ResolutionRunResult result = resolver.run(List.of(record("m1", "Jeffrey Epstein")));

            List<AuditAction> actions = resolver.getAuditService().getEntriesForRun(result.runId()).stream()
                    .map(e -> e.action())
                    .collect(Collectors.toList());
            assertEquals(AuditAction.RUN_STARTED, actions.get(0));
            assertEquals(AuditAction.RUN_COMMITTED, actions.get(actions.size() - 1));
        }

        @Test
        @DisplayName("A dangling link in the previous snapshot aborts the run and keeps the old snapshot")
        void testIntegrityViolationAborts() {
            ResolutionRunResult first = resolver.run(List.of(
                    record("m1", "Jeffrey Epstein"), record("m2", "Ghislaine Maxwell")));

            DataIntegrityException ex = assertThrows(DataIntegrityException.class,
                    () -> resolver.run(List.of(record("m1", "Jeffrey Epstein"))));

            String entityId = entityOf(first, "m2").getEntityId();
            assertEquals(List.of(entityId + "/m2"), ex.getOffendingIds());
            ResolutionSnapshot current = resolver.currentSnapshot().orElseThrow();
            assertEquals(first.runId(), current.getRunId());
            assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.RUN_ABORTED).size());
            assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.RUN_COMMITTED).size());
        }

        @Test
        @DisplayName("An unexpected failure aborts the run without committing")
        void testUnexpectedFailureAborts() {
            NameParser broken = rawName -> {
                throw new IllegalStateException("tagger unavailable");
            };
            try (IdentityResolver failing = IdentityResolver.builder()
                    .config(ResolutionConfig.builder().parallelism(1).build())
                    .nameParser(broken)
                    .build()) {
                ResolutionAbortedException ex = assertThrows(ResolutionAbortedException.class,
                        () -> failing.run(List.of(record("m1", "Jeffrey Epstein"))));

                assertNotNull(ex.getRunId());
                assertInstanceOf(IllegalStateException.class, ex.getCause());
                assertTrue(failing.currentSnapshot().isEmpty());
                assertEquals(1, failing.getAuditService().getEntriesByAction(AuditAction.RUN_ABORTED).size());
                assertTrue(failing.getAuditService().getEntriesByAction(AuditAction.RUN_STARTED).isEmpty());
            }
        }

        @Test
        @DisplayName("A failed snapshot commit publishes no decisions, suppressions or review items")
        void testFailedStoreCommitLeavesNoTrace() {
            ResolutionStore failingStore = new ResolutionStore() {
                @Override
                public Optional<ResolutionSnapshot> current() {
                    return Optional.empty();
                }

                @Override
                public ResolutionSnapshot commit(ResolutionSnapshot snapshot) {
                    throw new IllegalStateException("store unavailable");
                }
            };
            try (IdentityResolver failing = IdentityResolver.builder()
                    .config(ResolutionConfig.builder().parallelism(1).build())
                    .resolutionStore(failingStore)
                    .build()) {
                assertThrows(ResolutionAbortedException.class, () -> failing.run(List.of(
                        protectedRecord("m1", "Jeffrey Epstein"),
                        record("m2", "Jeffrey Epstein"),
                        record("m3", "Jon Smith"),
                        record("m4", "John Smyth"))));

                assertEquals(0, failing.getMergeDecisionLog().size());
                assertEquals(0, failing.getSuppressionRegistry().size());
                assertFalse(failing.getSuppressionRegistry().isSuppressed("m1"));
                assertEquals(0L, failing.getReviewService().getPendingCount());
                assertTrue(failing.getAuditService().getEntriesByAction(AuditAction.REVIEW_REQUESTED).isEmpty());
                assertTrue(failing.getAuditService().getEntriesByAction(AuditAction.ENTITY_SUPPRESSED).isEmpty());
                assertEquals(1, failing.getAuditService().getEntriesByAction(AuditAction.RUN_ABORTED).size());
            }
        }

        @Test
        @DisplayName("No snapshot or projection exists before the first run")
        void testNoSnapshotBeforeFirstRun() {
            assertTrue(resolver.currentSnapshot().isEmpty());
            assertTrue(resolver.publicProjection().isEmpty());
        }

        @Test
        @DisplayName("A caller-supplied executor is left running on close")
        void testExternalExecutorNotShutDown() {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                IdentityResolver withExecutor = IdentityResolver.builder()
                        .config(ResolutionConfig.builder().build())
                        .executor(executor)
                        .build();
                withExecutor.run(List.of(record("m1", "Jeffrey Epstein"), record("m2", "Jeffrey Epstein")));
                withExecutor.close();

                assertFalse(executor.isShutdown());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Runs publish decision counters and duration timers")
        void testMetricsPublished() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            try (IdentityResolver metered = IdentityResolver.builder()
                    .config(ResolutionConfig.builder().parallelism(1).build())
                    .meterRegistry(registry)
                    .build()) {
                metered.run(List.of(record("m1", "Jeffrey Epstein"), record("m2", "Jeffrey Epstein")));

                assertEquals(1.0, registry.get("identity.edge.decision")
                        .tag("decision", "AUTO_MERGE").counter().count());
                assertEquals(1L, registry.get("identity.run.duration")
                        .tag("outcome", "committed").timer().count());
            }
        }
    }
}
