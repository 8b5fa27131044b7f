package com.orderline.resolution.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes a retail unit price from a cost basis. Pure and deterministic.
 *
 * <pre>
 * markup    = (base + volatility adjustment unless STABLE + category adjustment) * trend + seasonal
 * candidate = cost * (1 + markup / 100)
 * minimum   = cost * (1 + minimum margin / 100)
 * price     = max(candidate, minimum), rounded half-up to cents, never below minimum
 * </pre>
 */
public class PricingResolver {

    public static final int PRICE_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @throws IllegalArgumentException if the cost basis is missing or negative
     * @throws InvalidPricingContextException if the context is missing
     */
    public BigDecimal price(BigDecimal costBasis, PricingContext context) {
        if (costBasis == null || costBasis.signum() < 0) {
            throw new IllegalArgumentException("costBasis must be >= 0, got " + costBasis);
        }
        if (context == null) {
            throw new InvalidPricingContextException("No pricing context supplied");
        }
        BigDecimal candidate = applyMarkup(costBasis, totalMarkupPct(context));
        BigDecimal minimum = minimumPrice(costBasis, context);
        BigDecimal price = candidate.max(minimum).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        if (price.compareTo(minimum) < 0) {
            // rounding must not cut into the margin floor
            price = minimum.setScale(PRICE_SCALE, RoundingMode.CEILING);
        }
        return price;
    }

    public BigDecimal totalMarkupPct(PricingContext context) {
        BigDecimal markup = context.baseMarkupPct();
        if (context.volatility().attractsAdjustment()) {
            markup = markup.add(context.volatilityAdjustmentPct());
        }
        markup = markup.add(context.categoryAdjustmentPct());
        return markup.multiply(context.trendMultiplier()).add(context.seasonalAdjustmentPct());
    }

    /**
     * Lowest price that keeps the minimum margin, unrounded.
     */
    public BigDecimal minimumPrice(BigDecimal costBasis, PricingContext context) {
        return applyMarkup(costBasis, context.minimumMarginPct());
    }

    private static BigDecimal applyMarkup(BigDecimal cost, BigDecimal pct) {
        return cost.add(cost.multiply(pct).divide(HUNDRED));
    }
}
