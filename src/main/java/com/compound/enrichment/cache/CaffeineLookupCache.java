package com.compound.enrichment.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed lookup cache.
 */
public class CaffeineLookupCache implements LookupCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineLookupCache.class);

    private final Cache<CacheKey, CachedLookup> cache;

    public CaffeineLookupCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineLookupCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    /**
     * Creates the cache described by the configuration, or a no-op one when disabled.
     */
    public static LookupCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineLookupCache(config) : new NoOpLookupCache();
    }

    @Override
    public Optional<CachedLookup> get(String sourceId, String key) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(sourceId, key)));
    }

    @Override
    public void put(String sourceId, String key, CachedLookup lookup) {
        cache.put(new CacheKey(sourceId, key), lookup);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all lookup cache entries");
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

    record CacheKey(String sourceId, String key) {}
}
