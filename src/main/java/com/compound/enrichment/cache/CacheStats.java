package com.compound.enrichment.cache;

import java.util.Locale;

/**
 * Snapshot of lookup cache statistics, logged in the run summary.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long lookups = hitCount + missCount;
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "CacheStats{hits=%d, misses=%d, hitRate=%.2f, evictions=%d, size=%d}",
                hitCount, missCount, hitRate(), evictionCount, size);
    }
}
