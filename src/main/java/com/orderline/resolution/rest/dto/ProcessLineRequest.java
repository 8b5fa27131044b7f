package com.orderline.resolution.rest.dto;

/**
 * Request DTO for resolving a line and confirming it when the tier allows.
 */
public record ProcessLineRequest(String rawText, String customerSegment) {
    public ProcessLineRequest {
        if (rawText == null || rawText.isBlank()) {
            throw new IllegalArgumentException("rawText is required");
        }
        if (customerSegment == null || customerSegment.isBlank()) {
            throw new IllegalArgumentException("customerSegment is required");
        }
    }
}
