package com.orderline.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model Tests")
class ModelTest {

    @Nested
    @DisplayName("StockLot")
    class StockLotTests {

        @Test
        @DisplayName("Reserve, release and sell move quantities and bump the version")
        void movements() {
            StockLot lot = StockLot.of("lot-1", "p-1", "KG", new BigDecimal("5"));
            assertEquals("kg", lot.unit());

            StockLot reserved = lot.reserve(new BigDecimal("2"));
            assertEquals(0, new BigDecimal("3").compareTo(reserved.available()));
            assertEquals(0, new BigDecimal("2").compareTo(reserved.reserved()));
            assertEquals(1L, reserved.version());

            StockLot released = reserved.release(BigDecimal.ONE);
            assertEquals(0, new BigDecimal("4").compareTo(released.available()));

            StockLot sold = released.sell(BigDecimal.ONE);
            assertEquals(0, BigDecimal.ZERO.compareTo(sold.reserved()));
            assertEquals(0, new BigDecimal("4").compareTo(sold.total()));
            assertEquals(3L, sold.version());
        }

        @Test
        @DisplayName("Quantities never go negative")
        void neverNegative() {
            StockLot lot = StockLot.of("lot-1", "p-1", "kg", new BigDecimal("1"));

            assertThrows(IllegalStateException.class, () -> lot.reserve(new BigDecimal("2")));
            assertThrows(IllegalStateException.class, () -> lot.release(BigDecimal.ONE));
            assertThrows(IllegalStateException.class, () -> lot.sell(BigDecimal.ONE));
            assertThrows(IllegalArgumentException.class,
                    () -> StockLot.of("lot-2", "p-1", "kg", new BigDecimal("-1")));
        }
    }

    @Nested
    @DisplayName("MatchCandidate")
    class MatchCandidateTests {

        private MatchCandidate candidate(String name, double score, boolean exact, int descriptors) {
            Map<String, Double> scores = new LinkedHashMap<>();
            if (exact) {
                scores.put("exact_name_match", 45.0);
            }
            return new MatchCandidate("id-" + name, name, scores, score, List.of(), descriptors);
        }

        @Test
        @DisplayName("Score is clipped to [0, 100]")
        void clipped() {
            assertEquals(100.0, candidate("a", 130.0, false, 0).totalScore());
            assertEquals(0.0, candidate("a", -5.0, false, 0).totalScore());
            assertThrows(IllegalArgumentException.class, () -> candidate("a", Double.NaN, false, 0));
        }

        @Test
        @DisplayName("Ranking breaks ties by exact name, descriptors, then name")
        void ranking() {
            List<MatchCandidate> candidates = new ArrayList<>(List.of(
                    candidate("Delta", 40.0, false, 0),
                    candidate("Charlie", 40.0, false, 1),
                    candidate("Bravo", 40.0, true, 0),
                    candidate("Alpha", 40.0, false, 0),
                    candidate("Echo", 55.0, false, 0)));

            candidates.sort(MatchCandidate.RANKING);

            assertEquals(List.of("Echo", "Bravo", "Charlie", "Alpha", "Delta"),
                    candidates.stream().map(MatchCandidate::canonicalName).toList());
        }

        @Test
        @DisplayName("Breakdown lists strategy points in scoring order")
        void breakdown() {
            Map<String, Double> scores = new LinkedHashMap<>();
            scores.put("exact_name_match", 45.0);
            scores.put("unit_match", 15.0);
            MatchCandidate c = new MatchCandidate("p-1", "Tomatoes", scores, 60.0, List.of(), 0);

            assertEquals("exact_name_match=45.0, unit_match=15.0", c.breakdown());
        }
    }

    @Nested
    @DisplayName("ResolvedOrderLine")
    class ResolvedOrderLineTests {

        private ResolvedOrderLine line() {
            return ResolvedOrderLine.builder()
                    .productId("p-1")
                    .quantity(new BigDecimal("3"))
                    .unitPrice(new BigDecimal("1.35"))
                    .fulfillmentMethod(FulfillmentMethod.EXACT_MATCH)
                    .build();
        }

        @Test
        @DisplayName("Line total is unit price times quantity in cents")
        void lineTotal() {
            ResolvedOrderLine line = line();
            assertEquals(new BigDecimal("4.05"), line.getLineTotal());
            assertEquals(OrderLineStatus.RESERVED, line.getStatus());
            assertEquals(0, BigDecimal.ZERO.compareTo(line.getShortfall()));
        }

        @Test
        @DisplayName("Only a reserved line can be fulfilled or voided")
        void transitions() {
            ResolvedOrderLine fulfilled = line();
            fulfilled.markFulfilled();
            assertThrows(IllegalStateException.class, fulfilled::markVoided);

            ResolvedOrderLine voided = line();
            voided.markVoided();
            assertThrows(IllegalStateException.class, voided::markFulfilled);
            assertEquals(new BigDecimal("0.00"), voided.getEffectiveTotal());
        }
    }
}
