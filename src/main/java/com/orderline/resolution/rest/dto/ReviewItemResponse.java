package com.orderline.resolution.rest.dto;

import com.orderline.resolution.review.ReviewItem;

import java.time.Instant;

/**
 * Response DTO for a review queue item.
 */
public record ReviewItemResponse(
        String id,
        String parsedLineId,
        String rawText,
        String candidateProductId,
        String candidateName,
        double score,
        String tier,
        String status,
        Instant submittedAt,
        String reviewerId,
        String chosenProductId,
        String orderLineId
) {
    public static ReviewItemResponse from(ReviewItem item) {
        return new ReviewItemResponse(
                item.getId(),
                item.getParsedLineId(),
                item.getRawText(),
                item.getCandidateProductId(),
                item.getCandidateName(),
                item.getScore(),
                item.getTier().name(),
                item.getStatus().name(),
                item.getSubmittedAt(),
                item.getReviewerId(),
                item.getChosenProductId(),
                item.getOrderLineId()
        );
    }
}
