package com.identity.resolution.review;

import com.identity.resolution.api.Page;
import com.identity.resolution.api.PageRequest;
import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.audit.AuditEntry;
import com.identity.resolution.audit.AuditService;
import com.identity.resolution.core.model.MentionPair;
import com.identity.resolution.logging.LogContext;
import com.identity.resolution.resolution.ReviewOverrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Coordinates the review queue with the audit trail.
 *
 * <p>Review decisions never mutate a committed snapshot. They are turned into
 * {@link ReviewOverrides} that the next resolution run honours: approved pairs are
 * merged, rejected pairs become cannot-link constraints.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final AuditService auditService;

    public ReviewService(ReviewQueue reviewQueue, AuditService auditService) {
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    /**
     * Submits an item unless its pair is already queued or decided.
     *
     * @return the audit entry describing the new request, or null if the pair was already known
     */
    public AuditEntry submitForReview(ReviewItem item) {
        ReviewItem stored = reviewQueue.submit(item);
        if (stored != item) {
            return null;
        }
        log.info("review.submitted reviewItemId={} pair={} score={}",
                item.getId(), item.getPair(), item.getSimilarityScore());
        return AuditEntry.builder()
                .action(AuditAction.REVIEW_REQUESTED)
                .subjectId(item.getId())
                .actorId(AuditService.SYSTEM_ACTOR)
                .runId(item.getRunId())
                .details(Map.of(
                        "mentionIdA", item.getMentionIdA(),
                        "mentionIdB", item.getMentionIdB(),
                        "similarityScore", item.getSimilarityScore()
                ))
                .build();
    }

    public void approveMatch(String reviewId, String reviewerId, String notes) {
        try (LogContext ctx = LogContext.forReview(reviewId, reviewerId)) {
            ReviewItem item = requireItem(reviewId);
            reviewQueue.approve(reviewId, reviewerId, notes);
            auditService.record(AuditAction.REVIEW_APPROVED, reviewId, reviewerId, decisionDetails(item, notes));
            log.info("review.approved reviewItemId={} pair={}", reviewId, item.getPair());
        }
    }

    public void rejectMatch(String reviewId, String reviewerId, String notes) {
        try (LogContext ctx = LogContext.forReview(reviewId, reviewerId)) {
            ReviewItem item = requireItem(reviewId);
            reviewQueue.reject(reviewId, reviewerId, notes);
            auditService.record(AuditAction.REVIEW_REJECTED, reviewId, reviewerId, decisionDetails(item, notes));
            log.info("review.rejected reviewItemId={} pair={}", reviewId, item.getPair());
        }
    }

    /**
     * Builds the overrides the next run applies from every decided review item.
     */
    public ReviewOverrides currentOverrides() {
        Set<MentionPair> forced = new TreeSet<>();
        Set<MentionPair> cannotLink = new TreeSet<>();
        for (ReviewItem item : reviewQueue.findDecided()) {
            if (item.isApproved()) {
                forced.add(item.getPair());
            } else if (item.isRejected()) {
                cannotLink.add(item.getPair());
            }
        }
        return new ReviewOverrides(forced, cannotLink);
    }

    public Page<ReviewItem> getPendingReviews(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    public Page<ReviewItem> getPendingReviewsByScoreRange(double minScore, double maxScore, PageRequest page) {
        return reviewQueue.getPendingByScoreRange(minScore, maxScore, page);
    }

    public ReviewItem getReviewItem(String reviewId) {
        return reviewQueue.get(reviewId);
    }

    public long getPendingCount() {
        return reviewQueue.countPending();
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    private ReviewItem requireItem(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }

    private static Map<String, Object> decisionDetails(ReviewItem item, String notes) {
        return Map.of(
                "mentionIdA", item.getMentionIdA(),
                "mentionIdB", item.getMentionIdB(),
                "similarityScore", item.getSimilarityScore(),
                "notes", notes != null ? notes : ""
        );
    }
}
