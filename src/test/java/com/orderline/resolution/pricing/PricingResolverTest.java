package com.orderline.resolution.pricing;

import com.orderline.resolution.core.model.MarketVolatility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PricingResolver Tests")
class PricingResolverTest {

    private final PricingResolver resolver = new PricingResolver();

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    private static PricingContext context(MarketVolatility volatility, String base, String volatilityAdj,
                                          String minimum) {
        return PricingContext.of("standard", volatility, bd(base), bd(volatilityAdj), BigDecimal.ZERO, bd(minimum));
    }

    @Nested
    @DisplayName("Markup")
    class Markup {

        @Test
        @DisplayName("Volatile product gets base plus volatility markup")
        void volatileProduct() {
            BigDecimal price = resolver.price(bd("20"), context(MarketVolatility.VOLATILE, "25", "10", "15"));
            assertEquals(bd("27.00"), price);
        }

        @Test
        @DisplayName("Stable product gets the base markup only")
        void stableProduct() {
            BigDecimal price = resolver.price(bd("20"), context(MarketVolatility.STABLE, "25", "10", "15"));
            assertEquals(bd("25.00"), price);
        }

        @Test
        @DisplayName("Category, trend and seasonal adjustments combine")
        void fullFormula() {
            PricingContext ctx = new PricingContext("standard", MarketVolatility.STABLE, bd("20"), bd("10"),
                    bd("5"), bd("15"), bd("1.2"), bd("2"));

            assertEquals(0, bd("32").compareTo(resolver.totalMarkupPct(ctx)));
            assertEquals(bd("13.20"), resolver.price(bd("10"), ctx));
        }

        @ParameterizedTest
        @CsvSource({
                "20, 27.00",
                "0, 0.00",
                "1.99, 2.69",
                "100, 135.00"
        })
        @DisplayName("Price is rounded half-up to cents")
        void rounding(String cost, String expected) {
            BigDecimal price = resolver.price(bd(cost), context(MarketVolatility.VOLATILE, "25", "10", "15"));
            assertEquals(bd(expected), price);
        }
    }

    @Nested
    @DisplayName("Margin floor")
    class MarginFloor {

        @Test
        @DisplayName("Price never falls below the minimum margin")
        void floorApplies() {
            BigDecimal price = resolver.price(bd("20"), context(MarketVolatility.STABLE, "5", "0", "15"));
            assertEquals(bd("23.00"), price);
        }

        @Test
        @DisplayName("Rounding does not cut into the floor")
        void roundingRespectsFloor() {
            BigDecimal price = resolver.price(bd("0.333"), context(MarketVolatility.STABLE, "0", "0", "0"));

            assertEquals(bd("0.34"), price);
            assertTrue(price.compareTo(resolver.minimumPrice(bd("0.333"),
                    context(MarketVolatility.STABLE, "0", "0", "0"))) >= 0);
        }

        @ParameterizedTest
        @ValueSource(strings = {"0.01", "0.07", "1.13", "19.99", "20", "333.333"})
        @DisplayName("Price is at least cost times the minimum margin")
        void floorInvariant(String cost) {
            PricingContext ctx = context(MarketVolatility.HIGHLY_VOLATILE, "3", "1", "12.5");
            BigDecimal price = resolver.price(bd(cost), ctx);
            assertTrue(price.compareTo(resolver.minimumPrice(bd(cost), ctx)) >= 0);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Negative or missing cost is rejected")
        void invalidCost() {
            PricingContext ctx = context(MarketVolatility.STABLE, "25", "0", "15");
            assertThrows(IllegalArgumentException.class, () -> resolver.price(bd("-1"), ctx));
            assertThrows(IllegalArgumentException.class, () -> resolver.price(null, ctx));
        }

        @Test
        @DisplayName("Missing context is a pricing configuration error")
        void missingContext() {
            assertThrows(InvalidPricingContextException.class, () -> resolver.price(bd("20"), null));
        }

        @Test
        @DisplayName("Context requires a segment and non-negative markups")
        void contextValidation() {
            assertThrows(InvalidPricingContextException.class,
                    () -> PricingContext.of(" ", MarketVolatility.STABLE, bd("25"), null, null, bd("15")));
            assertThrows(InvalidPricingContextException.class,
                    () -> PricingContext.of("standard", MarketVolatility.STABLE, bd("-1"), null, null, bd("15")));
            assertThrows(InvalidPricingContextException.class,
                    () -> new PricingContext("standard", null, bd("25"), null, null, bd("15"), BigDecimal.ZERO, null));
        }
    }
}
