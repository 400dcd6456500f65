package com.identity.resolution.review;

import com.identity.resolution.api.Page;
import com.identity.resolution.api.PageRequest;
import com.identity.resolution.core.model.MentionPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ReviewQueue}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();
    private final ConcurrentMap<MentionPair, String> idByPair = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        String existingId = idByPair.putIfAbsent(item.getPair(), item.getId());
        if (existingId != null) {
            log.debug("Review item for pair {} already exists as {}", item.getPair(), existingId);
            return items.get(existingId);
        }
        items.put(item.getId(), item);
        log.debug("Submitted review item {} (pair={}, score={})",
                item.getId(), item.getPair(), item.getSimilarityScore());
        return item;
    }

    @Override
    public Optional<ReviewItem> findByPair(MentionPair pair) {
        String id = idByPair.get(pair);
        return id != null ? Optional.ofNullable(items.get(id)) : Optional.empty();
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        List<ReviewItem> pending = items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getPair))
                .collect(Collectors.toList());
        return Page.slice(pending, page);
    }

    @Override
    public Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page) {
        List<ReviewItem> filtered = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getSimilarityScore() >= minScore && item.getSimilarityScore() <= maxScore)
                .sorted(Comparator.comparingDouble(ReviewItem::getSimilarityScore).reversed()
                        .thenComparing(ReviewItem::getPair))
                .collect(Collectors.toList());
        return Page.slice(filtered, page);
    }

    @Override
    public List<ReviewItem> findDecided() {
        return items.values().stream()
                .filter(item -> !item.isPending())
                .sorted(Comparator.comparing(ReviewItem::getPair))
                .collect(Collectors.toList());
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        pendingItem(reviewId).markApproved(reviewerId, notes);
        log.info("Review item {} approved by {}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        pendingItem(reviewId).markRejected(reviewerId, notes);
        log.info("Review item {} rejected by {}", reviewId, reviewerId);
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    @Override
    public long size() {
        return items.size();
    }

    private ReviewItem pendingItem(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
