package com.orderline.resolution.rest.dto;

import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.core.model.ResolutionResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Response DTO for a resolved line. {@code parsedLineId} is what confirm-match expects.
 */
public record ResolutionResponse(
        String parsedLineId,
        String rawText,
        BigDecimal quantity,
        String unit,
        List<String> productTokens,
        Set<String> descriptorTokens,
        String decisionTier,
        boolean requiresConfirmation,
        CandidateResponse bestMatch,
        List<CandidateResponse> suggestions,
        long catalogVersion
) {
    public static ResolutionResponse from(ResolutionResult result) {
        ParsedLine line = result.parsedLine();
        Set<String> unavailable = result.unavailableProductIds();
        return new ResolutionResponse(
                line.id(),
                line.rawText(),
                line.quantity(),
                line.unitToken(),
                line.productTokens(),
                line.descriptorTokens(),
                result.decisionTier().name(),
                result.requiresConfirmation(),
                result.best()
                        .map(c -> CandidateResponse.from(c, !unavailable.contains(c.catalogEntryId())))
                        .orElse(null),
                result.suggestions().stream()
                        .map(c -> CandidateResponse.from(c, !unavailable.contains(c.catalogEntryId())))
                        .toList(),
                result.catalogVersion()
        );
    }
}
