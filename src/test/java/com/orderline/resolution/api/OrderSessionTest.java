package com.orderline.resolution.api;

import com.orderline.resolution.audit.AuditAction;
import com.orderline.resolution.core.model.OrderLineStatus;
import com.orderline.resolution.core.model.ResolutionResult;
import com.orderline.resolution.core.model.ResolvedOrderLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrderSession Tests")
class OrderSessionTest {

    private OrderLineResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = OrderLineResolverTest.resolverBuilder().build();
        resolver.receiveStock("lot-1", "p-1", "kg", new BigDecimal("5"));
        resolver.receiveStock("lot-2", "p-3", "packet", new BigDecimal("4"));
    }

    private BigDecimal available(String productId) {
        return resolver.stockPosition(productId).availableQuantity();
    }

    private BigDecimal reserved(String productId) {
        return resolver.stockPosition(productId).reservedQuantity();
    }

    @Test
    @DisplayName("Commit sells every reserved line and totals the order")
    void commit() {
        OrderSummary summary;
        ResolvedOrderLine tomatoes;
        try (OrderSession order = resolver.beginOrder("restaurant")) {
            ResolutionResult result = order.resolve("2 kg tomatoes");
            tomatoes = order.confirm(result.parsedLine().id(), "p-1");
            order.process("5 lemons");

            summary = order.commit();
            assertTrue(order.isCommitted());
        }

        assertEquals(1, summary.lines().size());
        assertEquals(1, summary.queuedForReview());
        assertEquals(new BigDecimal("24.00"), summary.total());
        assertFalse(summary.hasErrors());
        assertEquals(OrderLineStatus.FULFILLED, tomatoes.getStatus());
        assertEquals(0, new BigDecimal("3").compareTo(available("p-1")));
        assertEquals(0, BigDecimal.ZERO.compareTo(reserved("p-1")));
        assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.ORDER_COMMITTED).size());
    }

    @Test
    @DisplayName("Abort releases every reservation")
    void abort() {
        OrderSession order = resolver.beginOrder("restaurant");
        ProcessedLine processed = order.process("2 kg tomatoes");

        OrderSummary summary = order.abort();

        assertEquals(OrderLineStatus.VOIDED, processed.orderLine().getStatus());
        assertEquals(new BigDecimal("0.00"), summary.total());
        assertEquals(0, new BigDecimal("5").compareTo(available("p-1")));
        assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.ORDER_ABORTED).size());
    }

    @Test
    @DisplayName("Closing without commit aborts")
    void closeWithoutCommit() {
        ResolvedOrderLine line;
        try (OrderSession order = resolver.beginOrder("restaurant")) {
            line = order.process("2 kg tomatoes").orderLine();
            assertEquals(0, new BigDecimal("2").compareTo(reserved("p-1")));
        }

        assertEquals(OrderLineStatus.VOIDED, line.getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(reserved("p-1")));
    }

    @Test
    @DisplayName("Lines voided during the session count as zero and are not sold")
    void voidedLineSkipped() {
        OrderSession order = resolver.beginOrder("restaurant");
        ResolvedOrderLine tomatoes = order.process("2 kg tomatoes").orderLine();
        ResolutionResult rosemary = order.resolve("1 packet rosemary 200g");
        ResolvedOrderLine packet = order.confirm(rosemary.parsedLine().id(), "p-3");

        resolver.voidLine(packet.getId());
        OrderSummary summary = order.commit();

        assertEquals(tomatoes.getLineTotal(), summary.total());
        assertEquals(OrderLineStatus.VOIDED, packet.getStatus());
        assertEquals(0, new BigDecimal("4").compareTo(available("p-3")));
    }

    @Test
    @DisplayName("A closed session refuses further work")
    void closedSession() {
        OrderSession order = resolver.beginOrder("restaurant");
        order.commit();

        assertThrows(IllegalStateException.class, () -> order.resolve("2 kg tomatoes"));
        assertThrows(IllegalStateException.class, () -> order.process("2 kg tomatoes"));
        assertThrows(IllegalStateException.class, order::commit);
        assertThrows(IllegalStateException.class, order::abort);
        assertDoesNotThrow(order::close);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("A customer segment is required")
    void segmentRequired(String segment) {
        assertThrows(IllegalArgumentException.class, () -> resolver.beginOrder(segment));
    }
}
