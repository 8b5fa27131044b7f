package com.orderline.resolution.core.model;

/**
 * Lifecycle of a confirmed order line.
 */
public enum OrderLineStatus {
    RESERVED,
    FULFILLED,
    VOIDED
}
