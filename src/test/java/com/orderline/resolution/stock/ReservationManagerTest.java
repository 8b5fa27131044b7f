package com.orderline.resolution.stock;

import com.orderline.resolution.core.model.FulfillmentMethod;
import com.orderline.resolution.core.model.StockLot;
import com.orderline.resolution.lock.LocalProductLock;
import com.orderline.resolution.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationManager Tests")
class ReservationManagerTest {

    @Mock
    private ProcurementGateway procurementGateway;

    @Mock
    private MetricsService metricsService;

    private InMemoryStockLedger ledger;
    private ReservationManager manager;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryStockLedger();
        manager = new ReservationManager(ledger, new LocalProductLock(), procurementGateway, metricsService);
    }

    private static BigDecimal qty(String value) {
        return new BigDecimal(value);
    }

    private static void assertQuantity(String expected, BigDecimal actual) {
        assertEquals(0, qty(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    private StockLot lot(String lotId) {
        return ledger.findLot(lotId).orElseThrow();
    }

    @Nested
    @DisplayName("Reserve")
    class Reserve {

        @Test
        @DisplayName("Combination reserve moves stock from available to reserved")
        void combinationReserve() {
            ledger.receive("lot-a", "p-1", "kg", qty("2"));
            ledger.receive("lot-b", "p-1", "kg", qty("5"));

            Reservation reservation = manager.reserve("p-1", qty("3"), "kg");

            assertEquals(FulfillmentMethod.COMBINATION, reservation.method());
            assertEquals(ReservationStatus.RESERVED, reservation.status());
            assertQuantity("0", lot("lot-a").available());
            assertQuantity("2", lot("lot-a").reserved());
            assertQuantity("4", lot("lot-b").available());
            assertQuantity("1", lot("lot-b").reserved());
            verify(metricsService).incrementReservation(FulfillmentMethod.COMBINATION);
            verifyNoInteractions(procurementGateway);
        }

        @Test
        @DisplayName("Shortfall is reserved as far as possible and sent to procurement")
        void shortfallGoesToProcurement() {
            ledger.receive("lot-a", "p-1", "kg", qty("2"));

            Reservation reservation = manager.reserve("p-1", qty("5"), "kg");

            assertEquals(FulfillmentMethod.PROCUREMENT_NEEDED, reservation.method());
            assertQuantity("3", reservation.shortfall());
            assertQuantity("0", lot("lot-a").available());

            ArgumentCaptor<ShortfallNotice> notice = ArgumentCaptor.forClass(ShortfallNotice.class);
            verify(procurementGateway).requestProcurement(notice.capture());
            assertQuantity("3", notice.getValue().shortfall());
            assertEquals(Urgency.HIGH, notice.getValue().urgency());
            assertEquals(reservation.id(), notice.getValue().reservationId());
            verify(metricsService).recordShortfall(3.0);
        }

        @Test
        @DisplayName("Nothing in stock is an urgent shortfall")
        void nothingInStock() {
            Reservation reservation = manager.reserve("p-1", qty("5"), "kg");

            assertTrue(reservation.allocations().isEmpty());
            ArgumentCaptor<ShortfallNotice> notice = ArgumentCaptor.forClass(ShortfallNotice.class);
            verify(procurementGateway).requestProcurement(notice.capture());
            assertEquals(Urgency.URGENT, notice.getValue().urgency());
        }

        @Test
        @DisplayName("Without shortfall allowance an uncovered request fails and changes nothing")
        void insufficientStock() {
            ledger.receive("lot-a", "p-1", "kg", qty("2"));

            InsufficientStockException e = assertThrows(InsufficientStockException.class,
                    () -> manager.reserve("p-1", qty("5"), "kg", false));

            assertEquals("p-1", e.getProductId());
            assertQuantity("2", e.getAvailable());
            assertQuantity("2", lot("lot-a").available());
            assertQuantity("0", lot("lot-a").reserved());
            verifyNoInteractions(procurementGateway);
        }

        @Test
        @DisplayName("Listeners receive one movement per lot")
        void listenersNotified() {
            ledger.receive("lot-a", "p-1", "kg", qty("2"));
            ledger.receive("lot-b", "p-1", "kg", qty("5"));
            List<StockMovement> movements = new ArrayList<>();
            manager.addListener(movements::add);

            Reservation reservation = manager.reserve("p-1", qty("3"), "kg");

            assertEquals(2, movements.size());
            assertTrue(movements.stream().allMatch(m -> m.type() == StockMovementType.FINISHED_RESERVE));
            assertTrue(movements.stream().allMatch(m -> m.reference().equals(reservation.id())));
        }
    }

    @Nested
    @DisplayName("Sell and release")
    class SellAndRelease {

        @Test
        @DisplayName("Sell removes reserved stock permanently")
        void sell() {
            ledger.receive("lot-a", "p-1", "kg", qty("5"));
            Reservation reservation = manager.reserve("p-1", qty("3"), "kg");

            Reservation sold = manager.sell(reservation.id());

            assertEquals(ReservationStatus.SOLD, sold.status());
            assertQuantity("2", lot("lot-a").available());
            assertQuantity("0", lot("lot-a").reserved());
            assertQuantity("2", lot("lot-a").total());
        }

        @Test
        @DisplayName("Release returns reserved stock to available")
        void release() {
            ledger.receive("lot-a", "p-1", "kg", qty("2"));
            ledger.receive("lot-b", "p-1", "kg", qty("5"));
            Reservation reservation = manager.reserve("p-1", qty("3"), "kg");

            Reservation released = manager.release(reservation.id());

            assertEquals(ReservationStatus.RELEASED, released.status());
            assertQuantity("2", lot("lot-a").available());
            assertQuantity("5", lot("lot-b").available());
            assertQuantity("0", lot("lot-b").reserved());
            assertEquals(ReservationStatus.RELEASED, manager.find(reservation.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("A finished reservation cannot be finished again")
        void finishTwice() {
            ledger.receive("lot-a", "p-1", "kg", qty("5"));
            Reservation reservation = manager.reserve("p-1", qty("3"), "kg");
            manager.sell(reservation.id());

            assertThrows(IllegalStateException.class, () -> manager.release(reservation.id()));
            assertThrows(IllegalStateException.class, () -> manager.sell(reservation.id()));
        }

        @Test
        @DisplayName("Unknown reservations are rejected")
        void unknownReservation() {
            assertThrows(IllegalArgumentException.class, () -> manager.release("missing"));
        }

        @Test
        @DisplayName("Sell and release publish their movements")
        void movementsPublished() {
            StockMovementListener listener = mock(StockMovementListener.class);
            ledger.receive("lot-a", "p-1", "kg", qty("5"));
            manager.addListener(listener);
            Reservation first = manager.reserve("p-1", qty("1"), "kg");
            Reservation second = manager.reserve("p-1", qty("1"), "kg");

            manager.sell(first.id());
            manager.release(second.id());

            ArgumentCaptor<StockMovement> movements = ArgumentCaptor.forClass(StockMovement.class);
            verify(listener, times(4)).onMovement(movements.capture());
            assertEquals(List.of(StockMovementType.FINISHED_RESERVE, StockMovementType.FINISHED_RESERVE,
                            StockMovementType.FINISHED_SELL, StockMovementType.FINISHED_RELEASE),
                    movements.getAllValues().stream().map(StockMovement::type).toList());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("One version conflict is retried against fresh stock")
        void conflictRetried() {
            FlakyLedger flaky = new FlakyLedger(1);
            flaky.receive("lot-a", "p-1", "kg", qty("5"));
            ReservationManager flakyManager = new ReservationManager(flaky, new LocalProductLock(),
                    procurementGateway, metricsService);

            Reservation reservation = flakyManager.reserve("p-1", qty("2"), "kg");

            assertEquals(ReservationStatus.RESERVED, reservation.status());
            verify(metricsService).incrementReservationConflict();
        }

        @Test
        @DisplayName("Repeated conflicts fail the reservation")
        void repeatedConflictsFail() {
            FlakyLedger flaky = new FlakyLedger(Integer.MAX_VALUE);
            flaky.receive("lot-a", "p-1", "kg", qty("5"));
            ReservationManager flakyManager = new ReservationManager(flaky, new LocalProductLock(),
                    procurementGateway, metricsService);

            assertThrows(ConcurrentReservationConflictException.class,
                    () -> flakyManager.reserve("p-1", qty("2"), "kg"));
            verify(metricsService, times(ReservationManager.MAX_ATTEMPTS)).incrementReservationConflict();
            assertQuantity("5", flaky.findLot("lot-a").orElseThrow().available());
        }

        @Test
        @DisplayName("Concurrent reservations never oversell a lot")
        void noOversell() throws Exception {
            ledger.receive("lot-a", "p-1", "kg", qty("5"));
            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger refused = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();

            try {
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        try {
                            manager.reserve("p-1", BigDecimal.ONE, "kg", false);
                            succeeded.incrementAndGet();
                        } catch (InsufficientStockException e) {
                            refused.incrementAndGet();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(5, succeeded.get());
            assertEquals(5, refused.get());
            assertQuantity("0", lot("lot-a").available());
            assertQuantity("5", lot("lot-a").reserved());
        }
    }

    /**
     * Ledger whose first {@code failures} replacements report a concurrent change.
     */
    private static class FlakyLedger extends InMemoryStockLedger {
        private final AtomicInteger remainingFailures;

        FlakyLedger(int failures) {
            this.remainingFailures = new AtomicInteger(failures);
        }

        @Override
        public synchronized boolean replaceAll(List<StockLot> expected, List<StockLot> updated) {
            if (remainingFailures.getAndDecrement() > 0) {
                return false;
            }
            return super.replaceAll(expected, updated);
        }
    }

    @Test
    @DisplayName("Manager requires its collaborators")
    void requiresCollaborators() {
        assertThrows(NullPointerException.class,
                () -> new ReservationManager(null, new LocalProductLock(), procurementGateway, metricsService));
        assertDoesNotThrow(() -> new ReservationManager(ledger).reserve("p-9", BigDecimal.ONE, "kg"));
        verify(procurementGateway, never()).requestProcurement(any());
    }
}
