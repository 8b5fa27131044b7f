package com.orderline.resolution.stock;

import com.orderline.resolution.catalog.UnitCompatibility;
import com.orderline.resolution.core.model.FulfillmentMethod;
import com.orderline.resolution.core.model.StockLot;
import com.orderline.resolution.core.model.StockPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only fulfillment planning for a confirmed product.
 *
 * <ul>
 *   <li>EXACT_MATCH: one lot holds exactly the request, or a lot counted in packages
 *       (not weighed or measured) holds enough.</li>
 *   <li>Otherwise lots are drawn smallest-available first, so part-used lots are emptied
 *       before a larger one is opened. A single lot drawn from is PARTIAL_USE; several
 *       lots are a COMBINATION.</li>
 *   <li>PROCUREMENT_NEEDED when all lots together fall short. Everything reservable is
 *       still allocated and the remainder is the shortfall.</li>
 * </ul>
 *
 * <p>Lot quantities in kg/g or l/ml are converted to the requested unit. Lots in an
 * unrelated unit are ignored.</p>
 */
public class StockAvailabilityChecker {
    private static final Logger log = LoggerFactory.getLogger(StockAvailabilityChecker.class);

    private final StockLedger ledger;

    public StockAvailabilityChecker(StockLedger ledger) {
        this.ledger = ledger;
    }

    /**
     * Plans the request against current stock without changing it.
     *
     * @param unit requested unit; null means "whatever the lots are counted in"
     * @throws IllegalArgumentException if the quantity is not positive
     */
    public FulfillmentPlan plan(String productId, BigDecimal quantity, String unit) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Requested quantity must be > 0, got " + quantity);
        }

        List<UsableLot> usable = new ArrayList<>();
        for (StockLot lot : ledger.lotsFor(productId)) {
            if (lot.available().signum() <= 0) {
                continue;
            }
            toRequestedUnit(lot.available(), lot.unit(), unit)
                    .ifPresent(available -> usable.add(new UsableLot(lot, available)));
        }

        Optional<UsableLot> exact = usable.stream()
                .filter(u -> u.available().compareTo(quantity) == 0)
                .findFirst()
                .or(() -> usable.stream()
                        .filter(u -> !UnitCompatibility.isMeasure(u.lot().unit()))
                        .filter(u -> u.available().compareTo(quantity) >= 0)
                        .min(Comparator.comparing(UsableLot::available)));
        if (exact.isPresent()) {
            UsableLot lot = exact.get();
            FulfillmentPlan plan = new FulfillmentPlan(productId, quantity, unit, FulfillmentMethod.EXACT_MATCH,
                    List.of(allocate(lot, quantity, unit)), quantity, BigDecimal.ZERO);
            logPlan(plan);
            return plan;
        }

        usable.sort(Comparator.comparing(UsableLot::available)
                .thenComparing(u -> u.lot().lotId()));

        List<Allocation> allocations = new ArrayList<>();
        BigDecimal remaining = quantity;
        for (UsableLot lot : usable) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal drawn = lot.available().min(remaining);
            allocations.add(allocate(lot, drawn, unit));
            remaining = remaining.subtract(drawn);
        }

        BigDecimal reservable = quantity.subtract(remaining);
        FulfillmentMethod method;
        if (remaining.signum() > 0) {
            method = FulfillmentMethod.PROCUREMENT_NEEDED;
        } else if (allocations.size() == 1) {
            method = FulfillmentMethod.PARTIAL_USE;
        } else {
            method = FulfillmentMethod.COMBINATION;
        }

        FulfillmentPlan plan = new FulfillmentPlan(productId, quantity, unit, method, allocations,
                reservable, remaining.max(BigDecimal.ZERO));
        logPlan(plan);
        return plan;
    }

    public StockPosition position(String productId) {
        return ledger.position(productId);
    }

    /**
     * True when any lot of the product has available stock.
     */
    public boolean isAvailable(String productId) {
        return position(productId).hasAvailable();
    }

    private static Allocation allocate(UsableLot usable, BigDecimal requestedUnits, String requestedUnit) {
        StockLot lot = usable.lot();
        BigDecimal inLotUnits = toLotUnit(requestedUnits, requestedUnit, lot.unit());
        return new Allocation(lot.lotId(), inLotUnits.min(lot.available()), lot.unit(), lot.version());
    }

    private static Optional<BigDecimal> toRequestedUnit(BigDecimal quantity, String lotUnit, String requestedUnit) {
        if (requestedUnit == null || requestedUnit.equalsIgnoreCase(lotUnit)) {
            return Optional.of(quantity);
        }
        Optional<BigDecimal> converted = UnitCompatibility.convert(quantity, lotUnit, requestedUnit);
        if (converted.isPresent()) {
            return converted;
        }
        // interchangeable packaging words (bag/packet) count one for one
        return UnitCompatibility.areCompatible(lotUnit, requestedUnit) ? Optional.of(quantity) : Optional.empty();
    }

    private static BigDecimal toLotUnit(BigDecimal quantity, String requestedUnit, String lotUnit) {
        if (requestedUnit == null) {
            return quantity;
        }
        return UnitCompatibility.convert(quantity, requestedUnit, lotUnit).orElse(quantity);
    }

    private static void logPlan(FulfillmentPlan plan) {
        log.debug("stock.planned product={} requested={} unit={} method={} lots={} shortfall={}",
                plan.productId(), plan.requested(), plan.unit(), plan.method(),
                plan.allocations().size(), plan.shortfall());
    }

    private record UsableLot(StockLot lot, BigDecimal available) {}
}
