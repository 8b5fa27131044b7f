package com.orderline.resolution.review;

import com.orderline.resolution.api.Page;
import com.orderline.resolution.api.PageRequest;
import com.orderline.resolution.core.model.DecisionTier;

import java.util.Optional;

/**
 * Queue of order lines waiting for human confirmation.
 */
public interface ReviewQueue {

    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    /**
     * Pending items of one tier, oldest first.
     */
    Page<ReviewItem> getPendingByTier(DecisionTier tier, PageRequest page);

    /**
     * Pending items scoring within [minScore, maxScore], highest score first.
     */
    Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is no longer pending
     */
    void approve(String reviewId, String reviewerId, String chosenProductId, String orderLineId, String notes);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is no longer pending
     */
    void reject(String reviewId, String reviewerId, String notes);

    Optional<ReviewItem> get(String reviewId);

    /**
     * The pending item raised for a parsed line, if any.
     */
    Optional<ReviewItem> findPendingForLine(String parsedLineId);

    long countPending();
}
