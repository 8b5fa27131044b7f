package com.orderline.resolution.scoring;

import com.orderline.resolution.core.model.CatalogEntry;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.rules.AliasTable;

import java.util.Map;

/**
 * Everything a {@link MatchStrategy} may look at: the parsed line, the candidate, the alias
 * table, the weights and the points already awarded by strategies earlier in the pipeline.
 */
public record ScoringInput(
        ParsedLine line,
        CatalogEntry candidate,
        AliasTable aliases,
        ScoringWeights weights,
        Map<MatchStrategy, Double> earlierPoints
) {
    public ScoringInput {
        earlierPoints = earlierPoints != null ? Map.copyOf(earlierPoints) : Map.of();
    }

    double pointsOf(MatchStrategy strategy) {
        return earlierPoints.getOrDefault(strategy, 0.0);
    }

    /**
     * Whether a strategy that matches on the product name itself (exact, overlap or alias) scored.
     */
    boolean nameMatched() {
        return pointsOf(MatchStrategy.EXACT_NAME_MATCH) > 0.0
                || pointsOf(MatchStrategy.WORD_OVERLAP_MATCH) > 0.0
                || pointsOf(MatchStrategy.ALIAS_MATCH) > 0.0;
    }
}
