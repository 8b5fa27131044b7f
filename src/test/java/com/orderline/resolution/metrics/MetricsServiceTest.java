package com.orderline.resolution.metrics;

import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.FulfillmentMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("Every method is callable")
        void callable() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolutionDuration(DecisionTier.AUTO, Duration.ofMillis(5));
                noOp.incrementLinesResolved(DecisionTier.NONE);
                noOp.recordMatchScore(75.0);
                noOp.incrementReservation(FulfillmentMethod.COMBINATION);
                noOp.incrementReservationConflict();
                noOp.recordShortfall(3.0);
                noOp.incrementLinesConfirmed();
                noOp.incrementLinesVoided();
                noOp.recordMessageSize(12);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Resolution duration is a timer tagged by tier")
        void resolutionDuration() {
            metrics.recordResolutionDuration(DecisionTier.AUTO, Duration.ofMillis(20));
            metrics.recordResolutionDuration(DecisionTier.AUTO, Duration.ofMillis(40));
            metrics.recordResolutionDuration(DecisionTier.NONE, Duration.ofMillis(5));

            Timer auto = registry.find("orderline.resolution.duration").tag("tier", "AUTO").timer();
            assertNotNull(auto);
            assertEquals(2, auto.count());
            assertEquals(60.0, auto.totalTime(TimeUnit.MILLISECONDS), 0.5);
        }

        @Test
        @DisplayName("Resolved lines are counted per tier")
        void linesResolved() {
            metrics.incrementLinesResolved(DecisionTier.SUGGESTION_LIST);
            metrics.incrementLinesResolved(DecisionTier.SUGGESTION_LIST);
            metrics.incrementLinesResolved(DecisionTier.AUTO);

            Counter suggestions = registry.find("orderline.lines.resolved").tag("tier", "SUGGESTION_LIST").counter();
            assertNotNull(suggestions);
            assertEquals(2.0, suggestions.count());
        }

        @Test
        @DisplayName("Reservations are counted per fulfillment method")
        void reservations() {
            metrics.incrementReservation(FulfillmentMethod.PROCUREMENT_NEEDED);
            metrics.incrementReservationConflict();

            Counter procurement = registry.find("orderline.reservations")
                    .tag("method", "PROCUREMENT_NEEDED").counter();
            assertNotNull(procurement);
            assertEquals(1.0, procurement.count());
            assertEquals(1.0, registry.get("orderline.reservations.conflicts").counter().count());
        }

        @Test
        @DisplayName("Scores, shortfalls and message sizes are distributions")
        void distributions() {
            metrics.recordMatchScore(75.0);
            metrics.recordMatchScore(25.0);
            metrics.recordShortfall(3.0);
            metrics.recordMessageSize(12);

            DistributionSummary scores = registry.get("orderline.match.score").summary();
            assertEquals(2, scores.count());
            assertEquals(100.0, scores.totalAmount());
            assertEquals(3.0, registry.get("orderline.stock.shortfall").summary().totalAmount());
            assertEquals(12.0, registry.get("orderline.message.size").summary().totalAmount());
        }

        @Test
        @DisplayName("Confirmed, voided and cache counters")
        void counters() {
            metrics.incrementLinesConfirmed();
            metrics.incrementLinesVoided();
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.get("orderline.lines.confirmed").counter().count());
            assertEquals(1.0, registry.get("orderline.lines.voided").counter().count());
            assertEquals(2.0, registry.get("orderline.cache.hit").counter().count());
            assertEquals(1.0, registry.get("orderline.cache.miss").counter().count());
        }
    }
}
