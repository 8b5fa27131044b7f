package com.orderline.resolution.cache;

import com.orderline.resolution.core.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Default when caching is disabled: never holds anything.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<List<MatchCandidate>> get(CandidateKey key) {
        return Optional.empty();
    }

    @Override
    public void put(CandidateKey key, List<MatchCandidate> candidates) {
        // no-op
    }

    @Override
    public void invalidateBefore(long catalogVersion) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
