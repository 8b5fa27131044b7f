package com.orderline.resolution.stock;

import com.orderline.resolution.core.model.FulfillmentMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StockAvailabilityChecker Tests")
class StockAvailabilityCheckerTest {

    private InMemoryStockLedger ledger;
    private StockAvailabilityChecker checker;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryStockLedger();
        checker = new StockAvailabilityChecker(ledger);
    }

    private static BigDecimal qty(String value) {
        return new BigDecimal(value);
    }

    private static void assertQuantity(String expected, BigDecimal actual) {
        assertEquals(0, qty(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Two lots summed smallest first are a combination")
    void combination() {
        ledger.receive("lot-a", "p-1", "kg", qty("2"));
        ledger.receive("lot-b", "p-1", "kg", qty("5"));

        FulfillmentPlan plan = checker.plan("p-1", qty("3"), "kg");

        assertEquals(FulfillmentMethod.COMBINATION, plan.method());
        assertEquals(List.of("lot-a", "lot-b"), plan.allocations().stream().map(Allocation::lotId).toList());
        assertQuantity("2", plan.allocations().get(0).quantity());
        assertQuantity("1", plan.allocations().get(1).quantity());
        assertTrue(plan.isFullyCovered());
    }

    @Test
    @DisplayName("A smaller lot is emptied before a larger one that alone would cover the request")
    void smallerLotDrainedFirst() {
        ledger.receive("lot-a", "p-1", "kg", qty("2"));
        ledger.receive("lot-b", "p-1", "kg", qty("5"));

        FulfillmentPlan plan = checker.plan("p-1", qty("4"), "kg");

        assertEquals(FulfillmentMethod.COMBINATION, plan.method());
        assertQuantity("2", plan.allocations().get(0).quantity());
        assertQuantity("2", plan.allocations().get(1).quantity());
        assertEquals("lot-b", plan.allocations().get(1).lotId());
    }

    @Test
    @DisplayName("A lot holding exactly the request is an exact match")
    void exactMatch() {
        ledger.receive("lot-a", "p-1", "kg", qty("5"));
        ledger.receive("lot-b", "p-1", "kg", qty("3"));

        FulfillmentPlan plan = checker.plan("p-1", qty("3"), "kg");

        assertEquals(FulfillmentMethod.EXACT_MATCH, plan.method());
        assertEquals("lot-b", plan.allocations().get(0).lotId());
    }

    @Test
    @DisplayName("Packaged stock with enough units is an exact match")
    void packagedExactMatch() {
        ledger.receive("lot-a", "p-1", "bag", qty("10"));

        FulfillmentPlan plan = checker.plan("p-1", qty("4"), "bag");

        assertEquals(FulfillmentMethod.EXACT_MATCH, plan.method());
        assertQuantity("4", plan.allocations().get(0).quantity());
    }

    @Test
    @DisplayName("Drawing down one larger weighed lot is partial use")
    void partialUse() {
        ledger.receive("lot-a", "p-1", "kg", qty("10"));

        FulfillmentPlan plan = checker.plan("p-1", qty("3"), "kg");

        assertEquals(FulfillmentMethod.PARTIAL_USE, plan.method());
        assertQuantity("3", plan.allocations().get(0).quantity());
    }

    @Test
    @DisplayName("Requests in grams draw from lots in kilograms")
    void convertsUnits() {
        ledger.receive("lot-a", "p-1", "kg", qty("2"));

        FulfillmentPlan plan = checker.plan("p-1", qty("500"), "g");

        assertEquals(FulfillmentMethod.PARTIAL_USE, plan.method());
        assertEquals("kg", plan.allocations().get(0).unit());
        assertQuantity("0.5", plan.allocations().get(0).quantity());
    }

    @Test
    @DisplayName("Shortfall plans reserve what exists and report the rest")
    void procurementNeeded() {
        ledger.receive("lot-a", "p-1", "kg", qty("2"));

        FulfillmentPlan plan = checker.plan("p-1", qty("5"), "kg");

        assertEquals(FulfillmentMethod.PROCUREMENT_NEEDED, plan.method());
        assertQuantity("2", plan.reservable());
        assertQuantity("3", plan.shortfall());
        assertFalse(plan.isFullyCovered());
    }

    @Test
    @DisplayName("No stock at all is a full shortfall")
    void noStock() {
        FulfillmentPlan plan = checker.plan("p-1", qty("5"), "kg");

        assertEquals(FulfillmentMethod.PROCUREMENT_NEEDED, plan.method());
        assertFalse(plan.hasAllocations());
        assertQuantity("5", plan.shortfall());
    }

    @Test
    @DisplayName("Lots in an unrelated unit are ignored")
    void unrelatedUnitIgnored() {
        ledger.receive("lot-a", "p-1", "bag", qty("10"));

        FulfillmentPlan plan = checker.plan("p-1", qty("1"), "kg");

        assertEquals(FulfillmentMethod.PROCUREMENT_NEEDED, plan.method());
    }

    @Test
    @DisplayName("Planning never changes stock")
    void planIsReadOnly() {
        ledger.receive("lot-a", "p-1", "kg", qty("2"));

        checker.plan("p-1", qty("1"), "kg");

        assertQuantity("2", ledger.findLot("lot-a").orElseThrow().available());
        assertEquals(0L, ledger.findLot("lot-a").orElseThrow().version());
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-1"})
    @DisplayName("Non-positive quantities are rejected")
    void rejectsNonPositive(String quantity) {
        assertThrows(IllegalArgumentException.class, () -> checker.plan("p-1", qty(quantity), "kg"));
    }
}
