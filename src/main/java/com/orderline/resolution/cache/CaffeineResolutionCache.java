package com.orderline.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.orderline.resolution.catalog.CatalogIndex;
import com.orderline.resolution.catalog.CatalogSwapListener;
import com.orderline.resolution.core.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed candidate cache. Registered as a {@link CatalogSwapListener} so that
 * entries scored against a replaced catalog are dropped as soon as the swap happens.
 */
public class CaffeineResolutionCache implements ResolutionCache, CatalogSwapListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CandidateKey, List<MatchCandidate>> cache;

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<MatchCandidate>> get(CandidateKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CandidateKey key, List<MatchCandidate> candidates) {
        cache.put(key, List.copyOf(candidates));
    }

    @Override
    public void invalidateBefore(long catalogVersion) {
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.catalogVersion() < catalogVersion);
        log.debug("cache.invalidated belowVersion={} removed={}", catalogVersion, before - cache.asMap().size());
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated all");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onCatalogSwapped(CatalogIndex previous, CatalogIndex current) {
        invalidateBefore(current.version());
    }
}
