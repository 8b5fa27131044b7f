package com.orderline.resolution.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads pricing rules from a JSON array.
 *
 * <pre>
 * [
 *   {"segment": "standard", "baseMarkup": 25, "volatilityAdjustment": 10, "minimumMargin": 15,
 *    "categoryAdjustments": {"herbs": 5}, "trendMultiplier": 1.0, "seasonalAdjustment": 0,
 *    "effectiveFrom": "2024-01-01", "effectiveUntil": null, "active": true}
 * ]
 * </pre>
 *
 * <p>Unlike catalog records, an invalid rule fails the whole load: a half-loaded rule set
 * would misprice customers.</p>
 */
public class JsonPricingRuleLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonPricingRuleLoader.class);

    private final ObjectMapper objectMapper;

    public JsonPricingRuleLoader() {
        this(new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    public JsonPricingRuleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws InvalidPricingContextException if the document or any rule is invalid
     */
    public List<PricingRule> load(InputStream input) {
        List<RuleRecord> records;
        try {
            records = objectMapper.readValue(input, new TypeReference<List<RuleRecord>>() {});
        } catch (IOException e) {
            throw new InvalidPricingContextException("Failed to read pricing rules: " + e.getMessage(), e);
        }

        List<PricingRule> rules = new ArrayList<>();
        for (RuleRecord record : records) {
            try {
                rules.add(PricingRule.builder()
                        .id(record.id())
                        .name(record.name())
                        .customerSegment(record.segment())
                        .baseMarkupPct(record.baseMarkup())
                        .volatilityAdjustmentPct(orZero(record.volatilityAdjustment()))
                        .minimumMarginPct(record.minimumMargin())
                        .categoryAdjustments(record.categoryAdjustments() != null ? record.categoryAdjustments() : Map.of())
                        .trendMultiplier(record.trendMultiplier() != null ? record.trendMultiplier() : BigDecimal.ONE)
                        .seasonalAdjustmentPct(orZero(record.seasonalAdjustment()))
                        .active(record.active() == null || record.active())
                        .effectiveFrom(record.effectiveFrom() != null ? record.effectiveFrom() : LocalDate.MIN)
                        .effectiveUntil(record.effectiveUntil())
                        .build());
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new InvalidPricingContextException(
                        "Invalid pricing rule for segment '" + record.segment() + "': " + e.getMessage(), e);
            }
        }
        log.info("pricing.rules.loaded count={}", rules.size());
        return rules;
    }

    /**
     * Loads the rules and saves each into the store.
     */
    public int loadInto(InputStream input, PricingRuleStore store) {
        List<PricingRule> rules = load(input);
        rules.forEach(store::save);
        return rules.size();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleRecord(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("segment") String segment,
            @JsonProperty("baseMarkup") BigDecimal baseMarkup,
            @JsonProperty("volatilityAdjustment") BigDecimal volatilityAdjustment,
            @JsonProperty("minimumMargin") BigDecimal minimumMargin,
            @JsonProperty("categoryAdjustments") Map<String, BigDecimal> categoryAdjustments,
            @JsonProperty("trendMultiplier") BigDecimal trendMultiplier,
            @JsonProperty("seasonalAdjustment") BigDecimal seasonalAdjustment,
            @JsonProperty("active") Boolean active,
            @JsonProperty("effectiveFrom") LocalDate effectiveFrom,
            @JsonProperty("effectiveUntil") LocalDate effectiveUntil
    ) {}
}
