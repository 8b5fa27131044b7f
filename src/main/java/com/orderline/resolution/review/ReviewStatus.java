package com.orderline.resolution.review;

/**
 * Status of a line waiting for human confirmation.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
