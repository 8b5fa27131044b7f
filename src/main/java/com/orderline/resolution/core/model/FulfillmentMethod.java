package com.orderline.resolution.core.model;

/**
 * How a stock reservation satisfies a requested quantity.
 */
public enum FulfillmentMethod {
    /** A single lot with matching packaging and enough available stock. */
    EXACT_MATCH,
    /** Several lots of the same product summed together. */
    COMBINATION,
    /** A larger lot drawn down fractionally. */
    PARTIAL_USE,
    /** Stock cannot cover the request; the shortfall goes to procurement. */
    PROCUREMENT_NEEDED
}
