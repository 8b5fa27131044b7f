package com.orderline.resolution.rest.dto;

/**
 * Request DTO for a multi-line order message.
 */
public record ResolveMessageRequest(String message) {
    public ResolveMessageRequest {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
    }
}
