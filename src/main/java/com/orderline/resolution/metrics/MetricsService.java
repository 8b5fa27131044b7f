package com.orderline.resolution.metrics;

import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.FulfillmentMethod;

import java.time.Duration;

/**
 * Records order-line resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs without a
 * metrics backend.
 */
public interface MetricsService {

    void recordResolutionDuration(DecisionTier tier, Duration duration);

    void incrementLinesResolved(DecisionTier tier);

    void recordMatchScore(double score);

    void incrementReservation(FulfillmentMethod method);

    void incrementReservationConflict();

    void recordShortfall(double shortfall);

    void incrementLinesConfirmed();

    void incrementLinesVoided();

    void recordMessageSize(int lines);

    void recordCacheHit();

    void recordCacheMiss();
}
