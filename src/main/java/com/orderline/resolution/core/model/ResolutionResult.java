package com.orderline.resolution.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of resolving one parsed line against the catalog.
 * Callers branch on {@link #decisionTier()} instead of catching exceptions.
 *
 * @param parsedLine            the parsed input
 * @param bestMatch             top candidate for AUTO and TOP_SUGGESTION, otherwise null
 * @param suggestions           ranked candidates, capped
 * @param decisionTier          automation-confidence bucket
 * @param requiresConfirmation  true unless the line may proceed unattended
 * @param unavailableProductIds suggested products that currently have no available stock
 * @param catalogVersion        version of the catalog snapshot that produced this result
 */
public record ResolutionResult(
        ParsedLine parsedLine,
        MatchCandidate bestMatch,
        List<MatchCandidate> suggestions,
        DecisionTier decisionTier,
        boolean requiresConfirmation,
        Set<String> unavailableProductIds,
        long catalogVersion
) {
    public ResolutionResult {
        Objects.requireNonNull(parsedLine, "parsedLine is required");
        Objects.requireNonNull(decisionTier, "decisionTier is required");
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        unavailableProductIds = unavailableProductIds != null ? Set.copyOf(unavailableProductIds) : Set.of();
        if (bestMatch != null && (decisionTier == DecisionTier.SUGGESTION_LIST || decisionTier == DecisionTier.NONE)) {
            throw new IllegalArgumentException("bestMatch must be null for tier " + decisionTier);
        }
    }

    /**
     * Empty result for a line with no usable candidates.
     */
    public static ResolutionResult none(ParsedLine parsedLine, long catalogVersion) {
        return new ResolutionResult(parsedLine, null, List.of(), DecisionTier.NONE, true, Set.of(), catalogVersion);
    }

    public Optional<MatchCandidate> best() {
        return Optional.ofNullable(bestMatch);
    }

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }

    /**
     * Looks up a candidate for the given product among the best match and suggestions.
     */
    public Optional<MatchCandidate> candidateFor(String productId) {
        if (bestMatch != null && bestMatch.catalogEntryId().equals(productId)) {
            return Optional.of(bestMatch);
        }
        return suggestions.stream()
                .filter(c -> c.catalogEntryId().equals(productId))
                .findFirst();
    }

    /**
     * Copy carrying the given out-of-stock flags.
     */
    public ResolutionResult withUnavailableProducts(Set<String> productIds) {
        return new ResolutionResult(parsedLine, bestMatch, suggestions, decisionTier,
                requiresConfirmation, productIds, catalogVersion);
    }
}
