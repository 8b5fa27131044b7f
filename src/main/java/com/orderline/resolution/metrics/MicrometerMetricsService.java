package com.orderline.resolution.metrics;

import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.FulfillmentMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code orderline.resolution.duration}: Timer (tag: tier)</li>
 *   <li>{@code orderline.lines.resolved}: Counter (tag: tier)</li>
 *   <li>{@code orderline.match.score}: DistributionSummary of best-match scores</li>
 *   <li>{@code orderline.reservations}: Counter (tag: method)</li>
 *   <li>{@code orderline.reservations.conflicts}: Counter</li>
 *   <li>{@code orderline.stock.shortfall}: DistributionSummary</li>
 *   <li>{@code orderline.lines.confirmed} / {@code orderline.lines.voided}: Counters</li>
 *   <li>{@code orderline.message.size}: DistributionSummary of lines per message</li>
 *   <li>{@code orderline.cache.hit} / {@code orderline.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary matchScoreSummary;
    private final DistributionSummary shortfallSummary;
    private final DistributionSummary messageSizeSummary;
    private final Counter conflictCounter;
    private final Counter confirmedCounter;
    private final Counter voidedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.matchScoreSummary = DistributionSummary.builder("orderline.match.score")
                .description("Distribution of best-match scores")
                .register(registry);
        this.shortfallSummary = DistributionSummary.builder("orderline.stock.shortfall")
                .description("Quantities handed to procurement")
                .register(registry);
        this.messageSizeSummary = DistributionSummary.builder("orderline.message.size")
                .description("Order lines per resolved message")
                .register(registry);
        this.conflictCounter = Counter.builder("orderline.reservations.conflicts")
                .description("Reservations that hit a concurrent stock change")
                .register(registry);
        this.confirmedCounter = Counter.builder("orderline.lines.confirmed")
                .description("Order lines confirmed into reservations")
                .register(registry);
        this.voidedCounter = Counter.builder("orderline.lines.voided")
                .description("Order lines voided")
                .register(registry);
        this.cacheHitCounter = Counter.builder("orderline.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("orderline.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(DecisionTier tier, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(tier.name(), k ->
                Timer.builder("orderline.resolution.duration")
                        .description("Duration of order-line resolution")
                        .tag("tier", tier.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementLinesResolved(DecisionTier tier) {
        counter("resolved:" + tier.name(), "orderline.lines.resolved",
                "Order lines resolved per decision tier", "tier", tier.name()).increment();
    }

    @Override
    public void recordMatchScore(double score) {
        matchScoreSummary.record(score);
    }

    @Override
    public void incrementReservation(FulfillmentMethod method) {
        counter("reservation:" + method.name(), "orderline.reservations",
                "Stock reservations per fulfillment method", "method", method.name()).increment();
    }

    @Override
    public void incrementReservationConflict() {
        conflictCounter.increment();
    }

    @Override
    public void recordShortfall(double shortfall) {
        shortfallSummary.record(shortfall);
    }

    @Override
    public void incrementLinesConfirmed() {
        confirmedCounter.increment();
    }

    @Override
    public void incrementLinesVoided() {
        voidedCounter.increment();
    }

    @Override
    public void recordMessageSize(int lines) {
        messageSizeSummary.record(lines);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, String name, String description, String tag, String value) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}
