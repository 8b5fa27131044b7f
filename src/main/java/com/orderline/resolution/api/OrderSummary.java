package com.orderline.resolution.api;

import com.orderline.resolution.core.model.ResolvedOrderLine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of committing or aborting an {@link OrderSession}.
 *
 * @param orderId          session identifier
 * @param customerSegment  segment the order was priced for
 * @param lines            lines confirmed in the session
 * @param queuedForReview  lines that went to review instead
 * @param total            sum of effective line totals; voided lines count as zero
 * @param errors           per-line failures
 */
public record OrderSummary(
        String orderId,
        String customerSegment,
        List<ResolvedOrderLine> lines,
        int queuedForReview,
        BigDecimal total,
        List<String> errors
) {
    public OrderSummary {
        lines = lines != null ? List.copyOf(lines) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
