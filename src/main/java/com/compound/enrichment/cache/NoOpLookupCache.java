package com.compound.enrichment.cache;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpLookupCache implements LookupCache {

    @Override
    public Optional<CachedLookup> get(String sourceId, String key) {
        return Optional.empty();
    }

    @Override
    public void put(String sourceId, String key, CachedLookup lookup) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
