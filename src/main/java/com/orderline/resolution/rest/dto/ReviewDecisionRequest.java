package com.orderline.resolution.rest.dto;

/**
 * Request DTO for approving or rejecting a review item. On approval,
 * {@code chosenProductId} and {@code customerSegment} override the queued values.
 */
public record ReviewDecisionRequest(
        String reviewerId,
        String chosenProductId,
        String customerSegment,
        String notes
) {
    public ReviewDecisionRequest {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new IllegalArgumentException("reviewerId is required");
        }
    }
}
