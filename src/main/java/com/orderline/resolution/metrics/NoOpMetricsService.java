package com.orderline.resolution.metrics;

import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.FulfillmentMethod;

import java.time.Duration;

/**
 * Metrics service that discards everything. Used when no registry is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(DecisionTier tier, Duration duration) {
    }

    @Override
    public void incrementLinesResolved(DecisionTier tier) {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void incrementReservation(FulfillmentMethod method) {
    }

    @Override
    public void incrementReservationConflict() {
    }

    @Override
    public void recordShortfall(double shortfall) {
    }

    @Override
    public void incrementLinesConfirmed() {
    }

    @Override
    public void incrementLinesVoided() {
    }

    @Override
    public void recordMessageSize(int lines) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
