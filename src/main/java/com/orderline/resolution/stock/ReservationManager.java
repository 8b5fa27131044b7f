package com.orderline.resolution.stock;

import com.orderline.resolution.core.model.FulfillmentMethod;
import com.orderline.resolution.core.model.StockLot;
import com.orderline.resolution.lock.LocalProductLock;
import com.orderline.resolution.lock.ProductLock;
import com.orderline.resolution.logging.LogContext;
import com.orderline.resolution.metrics.MetricsService;
import com.orderline.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * Two-phase stock reservation: {@link #reserve} holds stock, then {@link #sell} makes the
 * hold permanent or {@link #release} returns it to available stock.
 *
 * <p>Every mutation runs under the product's {@link ProductLock} and is written with a
 * lot-version check. A version conflict triggers one re-plan against fresh stock; a
 * second conflict fails with {@link ConcurrentReservationConflictException}.</p>
 */
public class ReservationManager {
    private static final Logger log = LoggerFactory.getLogger(ReservationManager.class);

    static final int MAX_ATTEMPTS = 2;

    private final StockLedger ledger;
    private final StockAvailabilityChecker checker;
    private final ProductLock lock;
    private final ProcurementGateway procurementGateway;
    private final MetricsService metricsService;
    private final Map<String, Reservation> reservations = new ConcurrentHashMap<>();
    private final List<StockMovementListener> listeners = new CopyOnWriteArrayList<>();

    public ReservationManager(StockLedger ledger) {
        this(ledger, new LocalProductLock(), new LoggingProcurementGateway(), new NoOpMetricsService());
    }

    public ReservationManager(StockLedger ledger, ProductLock lock,
                              ProcurementGateway procurementGateway, MetricsService metricsService) {
        this.ledger = Objects.requireNonNull(ledger, "ledger is required");
        this.checker = new StockAvailabilityChecker(ledger);
        this.lock = Objects.requireNonNull(lock, "lock is required");
        this.procurementGateway = Objects.requireNonNull(procurementGateway, "procurementGateway is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Reserves the request, accepting a shortfall that is handed to procurement.
     */
    public Reservation reserve(String productId, BigDecimal quantity, String unit) {
        return reserve(productId, quantity, unit, true);
    }

    /**
     * Reserves stock for the request.
     *
     * @param allowShortfall whether a partially covered request is reserved as far as possible
     *                       with the remainder sent to procurement
     * @throws InsufficientStockException if the request is not fully covered and
     *                                    {@code allowShortfall} is false
     * @throws ConcurrentReservationConflictException if stock changed during both attempts
     */
    public Reservation reserve(String productId, BigDecimal quantity, String unit, boolean allowShortfall) {
        return lock.withLock(productId, () -> {
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                FulfillmentPlan plan = checker.plan(productId, quantity, unit);
                if (!plan.isFullyCovered() && !allowShortfall) {
                    throw new InsufficientStockException(productId, quantity, plan.reservable());
                }
                Optional<Reservation> reservation = tryReserve(plan);
                if (reservation.isPresent()) {
                    return reservation.get();
                }
                metricsService.incrementReservationConflict();
                log.warn("reservation.conflict product={} attempt={}", productId, attempt);
            }
            throw new ConcurrentReservationConflictException(productId);
        });
    }

    /**
     * Returns reserved stock to available.
     *
     * @throws IllegalArgumentException if the reservation is unknown
     * @throws IllegalStateException if it is no longer open
     */
    public Reservation release(String reservationId) {
        return finish(reservationId, ReservationStatus.RELEASED, StockMovementType.FINISHED_RELEASE,
                (lot, quantity) -> lot.release(quantity));
    }

    /**
     * Converts the reservation into a sale; reserved stock leaves the lots permanently.
     *
     * @throws IllegalArgumentException if the reservation is unknown
     * @throws IllegalStateException if it is no longer open
     */
    public Reservation sell(String reservationId) {
        return finish(reservationId, ReservationStatus.SOLD, StockMovementType.FINISHED_SELL,
                (lot, quantity) -> lot.sell(quantity));
    }

    public Optional<Reservation> find(String reservationId) {
        return Optional.ofNullable(reservations.get(reservationId));
    }

    public StockAvailabilityChecker getChecker() {
        return checker;
    }

    public void addListener(StockMovementListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StockMovementListener listener) {
        listeners.remove(listener);
    }

    private Optional<Reservation> tryReserve(FulfillmentPlan plan) {
        List<StockLot> expected = new ArrayList<>();
        List<StockLot> updated = new ArrayList<>();
        for (Allocation allocation : plan.allocations()) {
            Optional<StockLot> current = ledger.findLot(allocation.lotId());
            if (current.isEmpty() || current.get().version() != allocation.lotVersion()) {
                return Optional.empty();
            }
            expected.add(current.get());
            updated.add(current.get().reserve(allocation.quantity()));
        }
        if (!ledger.replaceAll(expected, updated)) {
            return Optional.empty();
        }

        Instant now = Instant.now();
        Reservation reservation = new Reservation(UUID.randomUUID().toString(), plan.productId(),
                plan.requested(), plan.unit(), plan.method(), plan.allocations(), plan.shortfall(),
                ReservationStatus.RESERVED, now, now);
        reservations.put(reservation.id(), reservation);

        try (LogContext logCtx = LogContext.forReservation(reservation.id(), plan.productId())) {
            log.info("stock.reserved product={} quantity={} unit={} method={} lots={} shortfall={}",
                    plan.productId(), plan.requested(), plan.unit(), plan.method(),
                    plan.allocations().size(), plan.shortfall());
        }
        metricsService.incrementReservation(plan.method());
        publish(StockMovementType.FINISHED_RESERVE, reservation);

        if (plan.method() == FulfillmentMethod.PROCUREMENT_NEEDED) {
            metricsService.recordShortfall(plan.shortfall().doubleValue());
            procurementGateway.requestProcurement(ShortfallNotice.of(plan, reservation.id()));
        }
        return Optional.of(reservation);
    }

    private Reservation finish(String reservationId, ReservationStatus target, StockMovementType movement,
                               BiFunction<StockLot, BigDecimal, StockLot> change) {
        Reservation existing = reservations.get(reservationId);
        if (existing == null) {
            throw new IllegalArgumentException("Reservation not found: " + reservationId);
        }
        return lock.withLock(existing.productId(), () -> {
            Reservation current = reservations.get(reservationId);
            if (!current.isOpen()) {
                throw new IllegalStateException("Reservation " + reservationId + " is already " + current.status());
            }
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                List<StockLot> expected = new ArrayList<>();
                List<StockLot> updated = new ArrayList<>();
                for (Allocation allocation : current.allocations()) {
                    StockLot lot = ledger.findLot(allocation.lotId())
                            .orElseThrow(() -> new IllegalStateException("Lot disappeared: " + allocation.lotId()));
                    expected.add(lot);
                    updated.add(change.apply(lot, allocation.quantity()));
                }
                if (ledger.replaceAll(expected, updated)) {
                    Reservation finished = current.withStatus(target);
                    reservations.put(reservationId, finished);
                    try (LogContext logCtx = LogContext.forReservation(reservationId, current.productId())) {
                        log.info("stock.{} product={} quantity={} unit={}",
                                target == ReservationStatus.SOLD ? "sold" : "released",
                                current.productId(), current.quantity(), current.unit());
                    }
                    publish(movement, finished);
                    return finished;
                }
                metricsService.incrementReservationConflict();
                log.warn("reservation.conflict reservation={} attempt={}", reservationId, attempt);
            }
            throw new ConcurrentReservationConflictException(current.productId());
        });
    }

    private void publish(StockMovementType type, Reservation reservation) {
        for (Allocation allocation : reservation.allocations()) {
            StockMovement movement = StockMovement.of(type, reservation.productId(), allocation, reservation.id());
            for (StockMovementListener listener : listeners) {
                listener.onMovement(movement);
            }
        }
    }
}
