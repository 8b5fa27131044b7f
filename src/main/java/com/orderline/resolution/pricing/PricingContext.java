package com.orderline.resolution.pricing;

import com.orderline.resolution.core.model.MarketVolatility;

import java.math.BigDecimal;

/**
 * Segment and market parameters for pricing one product. All percentages are plain
 * numbers ({@code 25} means 25%).
 *
 * @param customerSegment         segment the price is for
 * @param volatility              market volatility of the product
 * @param baseMarkupPct           base markup
 * @param volatilityAdjustmentPct extra markup for any volatility other than STABLE
 * @param categoryAdjustmentPct   markup adjustment of the product's category
 * @param minimumMarginPct        margin the price never falls below
 * @param trendMultiplier         multiplier applied to the summed markup
 * @param seasonalAdjustmentPct   added after the trend multiplier
 */
public record PricingContext(
        String customerSegment,
        MarketVolatility volatility,
        BigDecimal baseMarkupPct,
        BigDecimal volatilityAdjustmentPct,
        BigDecimal categoryAdjustmentPct,
        BigDecimal minimumMarginPct,
        BigDecimal trendMultiplier,
        BigDecimal seasonalAdjustmentPct
) {
    public PricingContext {
        if (customerSegment == null || customerSegment.isBlank()) {
            throw new InvalidPricingContextException("customerSegment is required");
        }
        volatility = volatility != null ? volatility : MarketVolatility.STABLE;
        if (baseMarkupPct == null || baseMarkupPct.signum() < 0) {
            throw new InvalidPricingContextException("baseMarkupPct must be >= 0 for segment " + customerSegment);
        }
        if (minimumMarginPct == null || minimumMarginPct.signum() < 0) {
            throw new InvalidPricingContextException("minimumMarginPct must be >= 0 for segment " + customerSegment);
        }
        volatilityAdjustmentPct = volatilityAdjustmentPct != null ? volatilityAdjustmentPct : BigDecimal.ZERO;
        categoryAdjustmentPct = categoryAdjustmentPct != null ? categoryAdjustmentPct : BigDecimal.ZERO;
        trendMultiplier = trendMultiplier != null ? trendMultiplier : BigDecimal.ONE;
        if (trendMultiplier.signum() <= 0) {
            throw new InvalidPricingContextException("trendMultiplier must be > 0 for segment " + customerSegment);
        }
        seasonalAdjustmentPct = seasonalAdjustmentPct != null ? seasonalAdjustmentPct : BigDecimal.ZERO;
    }

    /**
     * Context without trend or seasonal adjustments.
     */
    public static PricingContext of(String customerSegment, MarketVolatility volatility,
                                    BigDecimal baseMarkupPct, BigDecimal volatilityAdjustmentPct,
                                    BigDecimal categoryAdjustmentPct, BigDecimal minimumMarginPct) {
        return new PricingContext(customerSegment, volatility, baseMarkupPct, volatilityAdjustmentPct,
                categoryAdjustmentPct, minimumMarginPct, BigDecimal.ONE, BigDecimal.ZERO);
    }
}
