package com.orderline.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging. Keys added through this context are
 * removed again on close.
 *
 * <pre>
 * try (LogContext logCtx = LogContext.forLine(correlationId, parsedLineId)) {
 *     log.info("line.resolved tier={} product={}", tier, productId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for resolving or confirming a single order line.
     */
    public static LogContext forLine(String correlationId, String parsedLineId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("parsedLineId", parsedLineId);
        ctx.put("operation", "resolve-line");
        return ctx;
    }

    /**
     * Context for a multi-line order session or message.
     */
    public static LogContext forOrder(String orderId) {
        LogContext ctx = new LogContext();
        ctx.put("orderId", orderId);
        ctx.put("operation", "order");
        return ctx;
    }

    /**
     * Context for stock effects of one reservation.
     */
    public static LogContext forReservation(String reservationId, String productId) {
        LogContext ctx = new LogContext();
        ctx.put("reservationId", reservationId);
        ctx.put("productId", productId);
        ctx.put("operation", "reservation");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another key-value pair to this context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
