package com.orderline.resolution.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderline.resolution.core.model.CatalogEntry;
import com.orderline.resolution.core.model.MarketVolatility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads catalog entries from a JSON array of product records.
 *
 * <pre>
 * [
 *   {"id": "p-1", "name": "Rosemary (200g packet)", "unit": "packet", "price": 18.50},
 *   {"id": "p-2", "name": "Carrots (10kg bag)", "unit": "bag", "price": 95.00,
 *    "category": "vegetables", "volatility": "volatile", "active": true}
 * ]
 * </pre>
 *
 * <p>Records without a name or unit, or with a negative price, are skipped and logged.
 * A malformed document fails the whole load so that a broken export never replaces a
 * good catalog.</p>
 */
public class JsonCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalogLoader.class);

    private final ObjectMapper objectMapper;

    public JsonCatalogLoader() {
        this(new ObjectMapper());
    }

    public JsonCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<CatalogEntry> load(InputStream input) {
        try {
            return toEntries(objectMapper.readValue(input, new TypeReference<List<ProductRecord>>() {}));
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read catalog JSON: " + e.getMessage(), e);
        }
    }

    public List<CatalogEntry> load(Reader reader) {
        try {
            return toEntries(objectMapper.readValue(reader, new TypeReference<List<ProductRecord>>() {}));
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read catalog JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Loads the entries and publishes them as a new snapshot.
     */
    public CatalogIndex loadInto(InputStream input, CatalogSnapshotHolder holder) {
        return holder.swap(load(input));
    }

    private List<CatalogEntry> toEntries(List<ProductRecord> records) {
        List<CatalogEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (ProductRecord record : records) {
            try {
                entries.add(CatalogEntry.builder()
                        .id(record.id())
                        .canonicalName(record.name())
                        .unit(record.unit())
                        .basePrice(record.price())
                        .active(record.active() == null || record.active())
                        .category(record.category())
                        .volatility(MarketVolatility.fromString(record.volatility()))
                        .build());
            } catch (IllegalArgumentException | NullPointerException e) {
                skipped++;
                log.warn("catalog.record.skipped id={} name='{}' reason={}", record.id(), record.name(), e.getMessage());
            }
        }
        log.info("catalog.loaded entries={} skipped={}", entries.size(), skipped);
        return entries;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProductRecord(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("unit") String unit,
            @JsonProperty("price") BigDecimal price,
            @JsonProperty("active") Boolean active,
            @JsonProperty("category") String category,
            @JsonProperty("volatility") String volatility
    ) {}
}
