package com.orderline.resolution.tracing;

/**
 * A traced unit of work, ended when closed.
 *
 * <pre>
 * try (Span span = tracingService.startSpan(SpanNames.RESOLVE_LINE)) {
 *     span.setAttribute("orderline.tier", result.decisionTier().name());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    /**
     * Marks a point in time inside the span, e.g. a retried reservation.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
