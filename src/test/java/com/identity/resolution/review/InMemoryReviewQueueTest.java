package com.identity.resolution.review;

import com.identity.resolution.api.Page;
import com.identity.resolution.api.PageRequest;
import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.MentionPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryReviewQueue Tests")
class InMemoryReviewQueueTest {

    private InMemoryReviewQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryReviewQueue();
    }

    private static ReviewItem item(String a, String b, double score) {
        return ReviewItem.builder()
                .pair(MentionPair.of(a, b))
                .rawNameA("Jon Smith")
                .rawNameB("John Smyth")
                .origin(CandidateOrigin.BLOCK)
                .similarityScore(score)
                .runId("run-1")
                .build();
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("Should hold one item per pair")
        void deduplicatesByPair() {
            ReviewItem first = queue.submit(item("m1", "m2", 0.8));
            ReviewItem second = queue.submit(item("m2", "m1", 0.8));

            assertSame(first, second);
            assertEquals(1, queue.size());
            assertEquals(first, queue.findByPair(MentionPair.of("m1", "m2")).orElseThrow());
        }

        @Test
        @DisplayName("Decided pairs are never re-queued")
        void decidedNotRequeued() {
            ReviewItem first = queue.submit(item("m1", "m2", 0.8));
            queue.reject(first.getId(), "alice", "different people");

            ReviewItem again = queue.submit(item("m1", "m2", 0.8));

            assertSame(first, again);
            assertEquals(0, queue.countPending());
        }

        @Test
        @DisplayName("New items start pending")
        void startsPending() {
            ReviewItem submitted = queue.submit(item("m1", "m2", 0.8));
            assertTrue(submitted.isPending());
            assertNotNull(submitted.getId());
            assertNotNull(submitted.getSubmittedAt());
            assertNull(submitted.getReviewedAt());
        }
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        @Test
        @DisplayName("Should approve a pending item")
        void approve() {
            ReviewItem submitted = queue.submit(item("m1", "m2", 0.8));
            queue.approve(submitted.getId(), "alice", "same person");

            ReviewItem stored = queue.get(submitted.getId());
            assertTrue(stored.isApproved());
            assertEquals("alice", stored.getReviewerId());
            assertEquals("same person", stored.getNotes());
            assertNotNull(stored.getReviewedAt());
            assertEquals(List.of(stored), queue.findDecided());
        }

        @Test
        @DisplayName("Should refuse to decide twice")
        void decideTwice() {
            ReviewItem submitted = queue.submit(item("m1", "m2", 0.8));
            queue.approve(submitted.getId(), "alice", null);

            assertThrows(IllegalStateException.class, () -> queue.reject(submitted.getId(), "bob", null));
        }

        @Test
        @DisplayName("Should reject unknown ids")
        void unknownId() {
            assertThrows(IllegalArgumentException.class, () -> queue.approve("missing", "alice", null));
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Pending items are paginated in submission order")
        void pendingPages() {
            Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
            for (int i = 0; i < 5; i++) {
                queue.submit(ReviewItem.builder()
                        .pair(MentionPair.of("a" + i, "b" + i))
                        .similarityScore(0.7)
                        .submittedAt(t0.plusSeconds(i))
                        .build());
            }

            Page<ReviewItem> first = queue.getPending(PageRequest.of(0, 2));
            Page<ReviewItem> last = queue.getPending(PageRequest.of(2, 2));

            assertEquals(5, first.totalElements());
            assertEquals(3, first.totalPages());
            assertTrue(first.hasNext());
            assertEquals("a0", first.content().get(0).getMentionIdA());
            assertEquals(1, last.numberOfElements());
            assertFalse(last.hasNext());
        }

        @Test
        @DisplayName("Score range query is inclusive and highest first")
        void scoreRange() {
            queue.submit(item("m1", "m2", 0.65));
            queue.submit(item("m3", "m4", 0.85));
            queue.submit(item("m5", "m6", 0.75));
            queue.submit(item("m7", "m8", 0.89));

            Page<ReviewItem> page = queue.getPendingByScoreRange(0.75, 0.85, PageRequest.first(10));

            assertEquals(List.of(0.85, 0.75),
                    page.content().stream().map(ReviewItem::getSimilarityScore).toList());
        }
    }
}
