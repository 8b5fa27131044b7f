package com.orderline.resolution.tracing;

/**
 * Span and attribute names used across the pipeline.
 */
public final class SpanNames {

    public static final String RESOLVE_LINE = "orderline.resolve";
    public static final String RESOLVE_MESSAGE = "orderline.resolve-message";
    public static final String CONFIRM_MATCH = "orderline.confirm";
    public static final String FULFILL_LINE = "orderline.fulfill";
    public static final String VOID_LINE = "orderline.void";
    public static final String ORDER_SESSION = "orderline.order";

    public static final String ATTR_PARSED_LINE = "orderline.parsed_line_id";
    public static final String ATTR_TIER = "orderline.tier";
    public static final String ATTR_SCORE = "orderline.score";
    public static final String ATTR_CANDIDATES = "orderline.candidates";
    public static final String ATTR_PRODUCT = "orderline.product_id";
    public static final String ATTR_METHOD = "orderline.fulfillment_method";
    public static final String ATTR_LINES = "orderline.lines";

    private SpanNames() {
    }
}
