package com.orderline.resolution.scoring;

import com.orderline.resolution.core.model.CatalogEntry;
import com.orderline.resolution.core.model.MatchCandidate;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.rules.AliasTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores catalog candidates for a parsed line by summing the points of every
 * {@link MatchStrategy}, applied in declaration order. The total is clipped to [0, 100].
 */
public class MatchScorer {
    private static final Logger log = LoggerFactory.getLogger(MatchScorer.class);

    private final AliasTable aliasTable;
    private final ScoringWeights weights;

    public MatchScorer() {
        this(AliasTable.defaults(), ScoringWeights.defaults());
    }

    public MatchScorer(AliasTable aliasTable, ScoringWeights weights) {
        this.aliasTable = aliasTable;
        this.weights = weights;
    }

    public MatchCandidate score(ParsedLine line, CatalogEntry candidate) {
        Map<MatchStrategy, Double> awarded = new EnumMap<>(MatchStrategy.class);
        Map<String, Double> strategyScores = new LinkedHashMap<>();
        List<String> reasons = new ArrayList<>();
        double total = 0.0;

        for (MatchStrategy strategy : MatchStrategy.values()) {
            double points = strategy.score(new ScoringInput(line, candidate, aliasTable, weights, awarded));
            awarded.put(strategy, points);
            if (points > 0.0) {
                strategyScores.put(strategy.key(), points);
                reasons.add(strategy.key());
                total += points;
            }
        }

        MatchCandidate scored = new MatchCandidate(candidate.getId(), candidate.getCanonicalName(),
                strategyScores, total, reasons, MatchStrategy.descriptorMatches(line, candidate));
        log.trace("candidate.scored line={} candidate='{}' score={} breakdown=[{}]",
                line.id(), candidate.getCanonicalName(), scored.totalScore(), scored.breakdown());
        return scored;
    }

    /**
     * Scores every candidate, keeping the input order.
     */
    public List<MatchCandidate> scoreAll(ParsedLine line, Collection<CatalogEntry> candidates) {
        List<MatchCandidate> scored = new ArrayList<>(candidates.size());
        for (CatalogEntry candidate : candidates) {
            scored.add(score(line, candidate));
        }
        return scored;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public AliasTable getAliasTable() {
        return aliasTable;
    }
}
