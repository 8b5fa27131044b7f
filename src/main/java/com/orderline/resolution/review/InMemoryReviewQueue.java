package com.orderline.resolution.review;

import com.orderline.resolution.api.Page;
import com.orderline.resolution.api.PageRequest;
import com.orderline.resolution.core.model.DecisionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link ReviewQueue} for single-JVM deployments and tests.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("review.queued reviewItemId={} parsedLineId={} candidate={} score={}",
                item.getId(), item.getParsedLineId(), item.getCandidateProductId(), item.getScore());
        return item;
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        List<ReviewItem> pending = items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getId))
                .toList();
        return Page.slice(pending, page);
    }

    @Override
    public Page<ReviewItem> getPendingByTier(DecisionTier tier, PageRequest page) {
        List<ReviewItem> filtered = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getTier() == tier)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getId))
                .toList();
        return Page.slice(filtered, page);
    }

    @Override
    public Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page) {
        List<ReviewItem> filtered = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getScore() >= minScore && item.getScore() <= maxScore)
                .sorted(Comparator.comparingDouble(ReviewItem::getScore).reversed())
                .toList();
        return Page.slice(filtered, page);
    }

    @Override
    public void approve(String reviewId, String reviewerId, String chosenProductId, String orderLineId,
                        String notes) {
        ReviewItem item = find(reviewId);
        synchronized (item) {
            requirePending(item);
            item.markApproved(reviewerId, chosenProductId, orderLineId, notes);
        }
        log.info("review.approved reviewItemId={} reviewer={} product={}", reviewId, reviewerId, chosenProductId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = find(reviewId);
        synchronized (item) {
            requirePending(item);
            item.markRejected(reviewerId, notes);
        }
        log.info("review.rejected reviewItemId={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public Optional<ReviewItem> get(String reviewId) {
        return Optional.ofNullable(items.get(reviewId));
    }

    @Override
    public Optional<ReviewItem> findPendingForLine(String parsedLineId) {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getParsedLineId().equals(parsedLineId))
                .findFirst();
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem find(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }

    private static void requirePending(ReviewItem item) {
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + item.getId());
        }
    }
}
