package com.orderline.resolution.cache;

import com.orderline.resolution.core.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Cache of scored candidates. Stock flags and tiers are never cached; they are
 * recomputed from the candidates on every lookup.
 */
public interface ResolutionCache {

    /**
     * @return the cached candidates, or empty if not cached
     */
    Optional<List<MatchCandidate>> get(CandidateKey key);

    void put(CandidateKey key, List<MatchCandidate> candidates);

    /**
     * Drops every entry computed against an older catalog version.
     */
    void invalidateBefore(long catalogVersion);

    void invalidateAll();

    CacheStats getStats();
}
