package com.orderline.resolution.rest.dto;

import com.orderline.resolution.core.model.MatchCandidate;

import java.util.List;
import java.util.Map;

/**
 * One scored product with its per-strategy breakdown.
 */
public record CandidateResponse(
        String productId,
        String canonicalName,
        double score,
        Map<String, Double> strategyScores,
        List<String> matchedReasons,
        boolean inStock
) {
    public static CandidateResponse from(MatchCandidate candidate, boolean inStock) {
        return new CandidateResponse(
                candidate.catalogEntryId(),
                candidate.canonicalName(),
                candidate.totalScore(),
                candidate.strategyScores(),
                candidate.matchedReasons(),
                inStock
        );
    }
}
