package com.orderline.resolution.pricing;

import com.orderline.resolution.core.model.MarketVolatility;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Source of the externally administered pricing rules.
 */
public interface PricingRuleStore {

    /**
     * The rule in force for the segment on the given date. When several overlap, the one
     * that started most recently wins.
     */
    Optional<PricingRule> findEffective(String customerSegment, LocalDate date);

    List<PricingRule> findAll();

    void save(PricingRule rule);

    /**
     * Pricing context for a product under the segment's effective rule.
     *
     * @throws InvalidPricingContextException if the segment has no effective rule
     */
    default PricingContext contextFor(String customerSegment, String category,
                                      MarketVolatility volatility, LocalDate date) {
        if (customerSegment == null || customerSegment.isBlank()) {
            throw new InvalidPricingContextException("customerSegment is required for pricing");
        }
        return findEffective(customerSegment, date)
                .orElseThrow(() -> new InvalidPricingContextException(
                        "No effective pricing rule for segment '" + customerSegment + "' on " + date))
                .toContext(category, volatility);
    }
}
