package com.compound.enrichment.cache;

/**
 * A definitive lookup outcome kept in the cache. A null value records "not found".
 */
public record CachedLookup(String value) {

    private static final CachedLookup NOT_FOUND = new CachedLookup(null);

    public static CachedLookup found(String value) {
        return new CachedLookup(value);
    }

    public static CachedLookup notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return value != null;
    }
}
