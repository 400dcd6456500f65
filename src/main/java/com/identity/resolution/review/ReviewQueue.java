package com.identity.resolution.review;

import com.identity.resolution.api.Page;
import com.identity.resolution.api.PageRequest;
import com.identity.resolution.core.model.MentionPair;

import java.util.List;
import java.util.Optional;

/**
 * Manual review queue. Holds at most one item per mention pair, whatever its status,
 * so repeated runs never queue the same pair twice.
 */
public interface ReviewQueue {

    /**
     * Submits a review item unless an item for the same pair already exists.
     *
     * @param item the review item to submit
     * @return the stored item: the submitted one, or the existing one for that pair
     */
    ReviewItem submit(ReviewItem item);

    Optional<ReviewItem> findByPair(MentionPair pair);

    Page<ReviewItem> getPending(PageRequest page);

    /**
     * Gets pending review items whose score lies in the given range, highest score first.
     */
    Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page);

    /**
     * Items a reviewer has approved or rejected.
     */
    List<ReviewItem> findDecided();

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void reject(String reviewId, String reviewerId, String notes);

    ReviewItem get(String reviewId);

    long countPending();

    long size();
}
