package com.orderline.resolution.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Tokenized form of one raw order line.
 *
 * @param id               identifier used to confirm a match later
 * @param rawText          the original text, untouched
 * @param quantity         requested quantity, 1 when the line carries none
 * @param unitToken        unit word found in the line, or null
 * @param productTokens    remaining product words in input order
 * @param descriptorTokens number+unit fragments distinct from the quantity (e.g. "200g")
 */
public record ParsedLine(
        String id,
        String rawText,
        BigDecimal quantity,
        String unitToken,
        List<String> productTokens,
        Set<String> descriptorTokens
) {
    public ParsedLine {
        Objects.requireNonNull(id, "id is required");
        rawText = rawText != null ? rawText : "";
        quantity = quantity != null && quantity.signum() >= 0 ? quantity : BigDecimal.ONE;
        productTokens = productTokens != null ? List.copyOf(productTokens) : List.of();
        descriptorTokens = descriptorTokens != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(descriptorTokens))
                : Set.of();
    }

    public static ParsedLine of(String rawText, BigDecimal quantity, String unitToken,
                                List<String> productTokens, Set<String> descriptorTokens) {
        return new ParsedLine(UUID.randomUUID().toString(), rawText, quantity, unitToken,
                productTokens, descriptorTokens);
    }

    /**
     * An empty line: no product words, quantity 1.
     */
    public static ParsedLine empty(String rawText) {
        return of(rawText, BigDecimal.ONE, null, List.of(), Set.of());
    }

    public Optional<String> unit() {
        return Optional.ofNullable(unitToken);
    }

    /**
     * Product words joined by single spaces.
     */
    public String productPhrase() {
        return String.join(" ", productTokens);
    }

    public boolean hasProductTokens() {
        return !productTokens.isEmpty();
    }

    /**
     * Copy with explicit quantity and unit overriding the parsed values; nulls keep the parsed ones.
     */
    public ParsedLine withOverrides(BigDecimal quantityOverride, String unitOverride) {
        return new ParsedLine(id, rawText,
                quantityOverride != null ? quantityOverride : quantity,
                unitOverride != null ? unitOverride : unitToken,
                productTokens, descriptorTokens);
    }
}
