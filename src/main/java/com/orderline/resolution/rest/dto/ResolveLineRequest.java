package com.orderline.resolution.rest.dto;

/**
 * Request DTO for resolving one raw order line.
 */
public record ResolveLineRequest(String rawText) {
    public ResolveLineRequest {
        if (rawText == null || rawText.isBlank()) {
            throw new IllegalArgumentException("rawText is required");
        }
    }
}
