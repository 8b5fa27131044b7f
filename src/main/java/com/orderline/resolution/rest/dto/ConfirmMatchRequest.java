package com.orderline.resolution.rest.dto;

/**
 * Request DTO for confirming a resolved line against a chosen product.
 */
public record ConfirmMatchRequest(String parsedLineId, String chosenProductId, String customerSegment) {
    public ConfirmMatchRequest {
        if (parsedLineId == null || parsedLineId.isBlank()) {
            throw new IllegalArgumentException("parsedLineId is required");
        }
        if (chosenProductId == null || chosenProductId.isBlank()) {
            throw new IllegalArgumentException("chosenProductId is required");
        }
    }
}
