package com.orderline.resolution.review;

import com.orderline.resolution.api.OrderLineResolutionService;
import com.orderline.resolution.api.Page;
import com.orderline.resolution.api.PageRequest;
import com.orderline.resolution.audit.AuditAction;
import com.orderline.resolution.audit.AuditService;
import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.ResolvedOrderLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Approve and reject workflows for lines waiting in the {@link ReviewQueue}.
 * Approval confirms the line through the resolution service, so stock is reserved and
 * the line priced exactly as for a direct confirmation. Both decisions are audited.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final OrderLineResolutionService resolutionService;
    private final AuditService auditService;

    public ReviewService(ReviewQueue reviewQueue, OrderLineResolutionService resolutionService,
                         AuditService auditService) {
        this.reviewQueue = reviewQueue;
        this.resolutionService = resolutionService;
        this.auditService = auditService;
    }

    /**
     * Approves a review item and confirms its line.
     *
     * @param chosenProductId product picked by the reviewer; null accepts the queued candidate
     * @param customerSegment segment to price for; null keeps the one given at submission
     * @return the confirmed order line
     * @throws IllegalArgumentException if the item is unknown, or there is no product to confirm
     * @throws IllegalStateException    if the item is no longer pending
     */
    public ResolvedOrderLine approve(String reviewId, String reviewerId, String chosenProductId,
                                     String customerSegment, String notes) {
        ReviewItem item = requirePending(reviewId);
        String productId = chosenProductId != null ? chosenProductId : item.getCandidateProductId();
        if (productId == null) {
            throw new IllegalArgumentException("Review item " + reviewId + " has no candidate; choose a product");
        }
        String segment = customerSegment != null ? customerSegment : item.getCustomerSegment();

        ResolvedOrderLine line = resolutionService.confirmMatch(item.getParsedLineId(), productId, segment,
                reviewerId, notes);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reviewItemId", reviewId);
        details.put("decision", "APPROVED");
        details.put("productId", productId);
        details.put("orderLineId", line.getId());
        details.put("overrodeCandidate", !productId.equals(item.getCandidateProductId()));
        details.put("notes", notes != null ? notes : "");
        auditService.record(AuditAction.MANUAL_REVIEW_COMPLETED, item.getParsedLineId(), reviewerId, details);

        log.info("review.approved reviewItemId={} product={} orderLine={}", reviewId, productId, line.getId());
        return line;
    }

    /**
     * Rejects a review item. The line is not confirmed and no stock moves.
     *
     * @throws IllegalArgumentException if the item is unknown
     * @throws IllegalStateException    if the item is no longer pending
     */
    public void reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = requirePending(reviewId);
        reviewQueue.reject(reviewId, reviewerId, notes);

        auditService.record(AuditAction.MANUAL_REVIEW_COMPLETED, item.getParsedLineId(), reviewerId, Map.of(
                "reviewItemId", reviewId,
                "decision", "REJECTED",
                "notes", notes != null ? notes : ""));
        log.info("review.rejected reviewItemId={} parsedLineId={}", reviewId, item.getParsedLineId());
    }

    public Page<ReviewItem> getPendingReviews(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    public Page<ReviewItem> getPendingReviewsByTier(DecisionTier tier, PageRequest page) {
        return reviewQueue.getPendingByTier(tier, page);
    }

    public Page<ReviewItem> getPendingReviewsByScoreRange(double minScore, double maxScore, PageRequest page) {
        return reviewQueue.getPendingByScoreRange(minScore, maxScore, page);
    }

    public Optional<ReviewItem> getReviewItem(String reviewId) {
        return reviewQueue.get(reviewId);
    }

    public long getPendingCount() {
        return reviewQueue.countPending();
    }

    private ReviewItem requirePending(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId)
                .orElseThrow(() -> new IllegalArgumentException("Review item not found: " + reviewId));
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
