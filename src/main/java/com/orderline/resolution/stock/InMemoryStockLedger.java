package com.orderline.resolution.stock;

import com.orderline.resolution.core.model.StockLot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link StockLedger}. Reads are lock-free; writes are serialized so that a
 * multi-lot replacement is all-or-nothing.
 */
public class InMemoryStockLedger implements StockLedger {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStockLedger.class);

    private final Map<String, StockLot> lots = new ConcurrentHashMap<>();
    private final Map<String, List<String>> lotIdsByProduct = new ConcurrentHashMap<>();

    @Override
    public List<StockLot> lotsFor(String productId) {
        List<String> ids = lotIdsByProduct.getOrDefault(productId, List.of());
        return ids.stream()
                .map(lots::get)
                .toList();
    }

    @Override
    public Optional<StockLot> findLot(String lotId) {
        return Optional.ofNullable(lots.get(lotId));
    }

    @Override
    public synchronized StockLot receive(String lotId, String productId, String unit, BigDecimal available) {
        StockLot existing = lots.get(lotId);
        StockLot stored;
        if (existing == null) {
            stored = StockLot.of(lotId, productId, unit, available);
            lotIdsByProduct.merge(productId, List.of(lotId), (a, b) -> {
                List<String> merged = new ArrayList<>(a);
                merged.addAll(b);
                return List.copyOf(merged);
            });
        } else {
            if (!existing.productId().equals(productId)) {
                throw new IllegalArgumentException("Lot " + lotId + " belongs to product " + existing.productId());
            }
            stored = new StockLot(lotId, productId, unit, available, existing.reserved(), existing.version() + 1);
        }
        lots.put(lotId, stored);
        log.debug("stock.received lot={} product={} available={} unit={}", lotId, productId, available, unit);
        return stored;
    }

    @Override
    public synchronized boolean replaceAll(List<StockLot> expected, List<StockLot> updated) {
        if (expected.size() != updated.size()) {
            throw new IllegalArgumentException("expected and updated lots differ in size");
        }
        for (int i = 0; i < expected.size(); i++) {
            StockLot lot = expected.get(i);
            if (!lot.lotId().equals(updated.get(i).lotId())) {
                throw new IllegalArgumentException("Lot order mismatch at index " + i);
            }
            StockLot current = lots.get(lot.lotId());
            if (current == null || current.version() != lot.version()) {
                log.debug("stock.version.mismatch lot={} expected={} actual={}",
                        lot.lotId(), lot.version(), current != null ? current.version() : null);
                return false;
            }
        }
        for (StockLot next : updated) {
            lots.put(next.lotId(), next);
        }
        return true;
    }
}
