package com.orderline.resolution.rest.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse conflict(String message, String path) {
        return new ErrorResponse(409, "Conflict", message, path);
    }

    /**
     * 409 carrying what was asked for and what could be had.
     */
    public static ErrorResponse insufficientStock(String message, String path, String productId,
                                                  String requested, String available) {
        return new ErrorResponse(409, "Insufficient Stock", message, path, Instant.now(), Map.of(
                "productId", productId,
                "requested", requested,
                "available", available));
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }
}
