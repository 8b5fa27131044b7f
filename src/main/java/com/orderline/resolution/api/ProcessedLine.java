package com.orderline.resolution.api;

import com.orderline.resolution.core.model.ResolutionResult;
import com.orderline.resolution.core.model.ResolvedOrderLine;
import com.orderline.resolution.review.ReviewItem;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@code processLine}: either the line was confirmed automatically, or it
 * waits in the review queue.
 *
 * @param resolution the resolution that drove the decision
 * @param orderLine  the confirmed line, or null when sent to review
 * @param reviewItem the queued review, or null when confirmed
 */
public record ProcessedLine(ResolutionResult resolution, ResolvedOrderLine orderLine, ReviewItem reviewItem) {

    public ProcessedLine {
        Objects.requireNonNull(resolution, "resolution is required");
        if ((orderLine == null) == (reviewItem == null)) {
            throw new IllegalArgumentException("exactly one of orderLine and reviewItem must be set");
        }
    }

    static ProcessedLine confirmed(ResolutionResult resolution, ResolvedOrderLine orderLine) {
        return new ProcessedLine(resolution, orderLine, null);
    }

    static ProcessedLine queued(ResolutionResult resolution, ReviewItem reviewItem) {
        return new ProcessedLine(resolution, null, reviewItem);
    }

    public boolean isConfirmed() {
        return orderLine != null;
    }

    public Optional<ResolvedOrderLine> getOrderLine() {
        return Optional.ofNullable(orderLine);
    }

    public Optional<ReviewItem> getReviewItem() {
        return Optional.ofNullable(reviewItem);
    }
}
