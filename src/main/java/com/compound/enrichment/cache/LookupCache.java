package com.compound.enrichment.cache;

import java.util.Optional;

/**
 * Cache of definitive lookup outcomes, keyed by source id and query key.
 * Failed lookups are never cached so they are retried.
 */
public interface LookupCache {

    Optional<CachedLookup> get(String sourceId, String key);

    void put(String sourceId, String key, CachedLookup lookup);

    void invalidateAll();

    CacheStats getStats();
}
