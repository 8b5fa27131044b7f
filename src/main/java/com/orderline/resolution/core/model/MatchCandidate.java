package com.orderline.resolution.core.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A scored catalog candidate for one parsed line.
 *
 * @param catalogEntryId       id of the candidate catalog entry
 * @param canonicalName        candidate name, used for display and tie-breaking
 * @param strategyScores       points per firing strategy, in scoring order
 * @param totalScore           sum of the strategy points clipped to [0, 100]
 * @param matchedReasons       firing strategy names in scoring order
 * @param descriptorMatchCount number of descriptor tokens found in the candidate
 */
public record MatchCandidate(
        String catalogEntryId,
        String canonicalName,
        Map<String, Double> strategyScores,
        double totalScore,
        List<String> matchedReasons,
        int descriptorMatchCount
) {
    public static final double MAX_SCORE = 100.0;

    /**
     * Best first: score, then exact-name presence, then descriptor matches, then name.
     */
    public static final Comparator<MatchCandidate> RANKING = Comparator
            .comparingDouble(MatchCandidate::totalScore).reversed()
            .thenComparing(MatchCandidate::hasExactNameMatch, Comparator.reverseOrder())
            .thenComparing(MatchCandidate::descriptorMatchCount, Comparator.reverseOrder())
            .thenComparing(MatchCandidate::canonicalName);

    public MatchCandidate {
        Objects.requireNonNull(catalogEntryId, "catalogEntryId is required");
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        strategyScores = strategyScores != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(strategyScores))
                : Map.of();
        matchedReasons = matchedReasons != null ? List.copyOf(matchedReasons) : List.of();
        if (Double.isNaN(totalScore)) {
            throw new IllegalArgumentException("totalScore must be a number");
        }
        totalScore = Math.max(0.0, Math.min(MAX_SCORE, totalScore));
        if (descriptorMatchCount < 0) {
            throw new IllegalArgumentException("descriptorMatchCount must be >= 0");
        }
    }

    public boolean hasExactNameMatch() {
        return strategyScores.getOrDefault("exact_name_match", 0.0) > 0.0;
    }

    public double scoreFor(String strategyName) {
        return strategyScores.getOrDefault(strategyName, 0.0);
    }

    /**
     * Human-readable breakdown such as {@code exact_name_match=45.0, unit_match=15.0}.
     */
    public String breakdown() {
        StringBuilder sb = new StringBuilder();
        strategyScores.forEach((name, points) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(name).append('=').append(points);
        });
        return sb.toString();
    }
}
