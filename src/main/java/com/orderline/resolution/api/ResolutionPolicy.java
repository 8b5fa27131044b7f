package com.orderline.resolution.api;

import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.MatchCandidate;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.core.model.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Ranks scored candidates and assigns the decision tier.
 *
 * <table>
 *   <caption>Default tiers</caption>
 *   <tr><th>Best score</th><th>Tier</th><th>Result</th></tr>
 *   <tr><td>&ge; 50</td><td>AUTO</td><td>best match, no confirmation</td></tr>
 *   <tr><td>25 to 50</td><td>TOP_SUGGESTION</td><td>best match flagged for confirmation, plus suggestions</td></tr>
 *   <tr><td>10 to 25</td><td>SUGGESTION_LIST</td><td>suggestions only</td></tr>
 *   <tr><td>&lt; 10</td><td>NONE</td><td>empty</td></tr>
 * </table>
 *
 * <p>Never throws for "no match"; callers branch on the tier.</p>
 */
public class ResolutionPolicy {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPolicy.class);

    private final ResolutionOptions options;

    public ResolutionPolicy() {
        this(ResolutionOptions.defaults());
    }

    public ResolutionPolicy(ResolutionOptions options) {
        this.options = options;
    }

    public ResolutionResult resolve(ParsedLine line, Collection<MatchCandidate> candidates) {
        return resolve(line, candidates, 0L);
    }

    public ResolutionResult resolve(ParsedLine line, Collection<MatchCandidate> candidates, long catalogVersion) {
        if (candidates == null || candidates.isEmpty()) {
            log.debug("line.resolved line={} tier={} candidates=0", line.id(), DecisionTier.NONE);
            return ResolutionResult.none(line, catalogVersion);
        }

        List<MatchCandidate> ranked = candidates.stream()
                .sorted(MatchCandidate.RANKING)
                .toList();
        MatchCandidate top = ranked.get(0);
        DecisionTier tier = tierFor(top.totalScore());

        if (tier == DecisionTier.NONE) {
            log.debug("line.resolved line={} tier={} topScore={}", line.id(), tier, top.totalScore());
            return ResolutionResult.none(line, catalogVersion);
        }

        List<MatchCandidate> suggestions = ranked.stream()
                .filter(c -> c.totalScore() >= options.getSuggestionListThreshold())
                .limit(options.getMaxSuggestions())
                .toList();

        MatchCandidate best = switch (tier) {
            case AUTO, TOP_SUGGESTION -> top;
            default -> null;
        };
        boolean requiresConfirmation = switch (tier) {
            case AUTO -> false;
            case TOP_SUGGESTION -> !options.isAllowUnattendedTopSuggestion();
            default -> true;
        };

        if (tier == DecisionTier.AUTO) {
            log.info("line.resolved line={} tier={} product={} score={} breakdown=[{}]",
                    line.id(), tier, top.catalogEntryId(), top.totalScore(), top.breakdown());
        } else {
            log.debug("line.resolved line={} tier={} topScore={} suggestions={}",
                    line.id(), tier, top.totalScore(), suggestions.size());
        }
        return new ResolutionResult(line, best, suggestions, tier, requiresConfirmation, Set.of(), catalogVersion);
    }

    public DecisionTier tierFor(double score) {
        if (score >= options.getAutoThreshold()) {
            return DecisionTier.AUTO;
        }
        if (score >= options.getTopSuggestionThreshold()) {
            return DecisionTier.TOP_SUGGESTION;
        }
        if (score >= options.getSuggestionListThreshold()) {
            return DecisionTier.SUGGESTION_LIST;
        }
        return DecisionTier.NONE;
    }

    public ResolutionOptions getOptions() {
        return options;
    }
}
