package com.orderline.resolution.audit;

/**
 * Auditable actions along the order-line pipeline.
 */
public enum AuditAction {
    LINE_RESOLVED,
    MATCH_CONFIRMED,
    PROCUREMENT_REQUESTED,
    STOCK_SOLD,
    LINE_VOIDED,
    ORDER_COMMITTED,
    ORDER_ABORTED,
    MANUAL_REVIEW_REQUESTED,
    MANUAL_REVIEW_COMPLETED
}
