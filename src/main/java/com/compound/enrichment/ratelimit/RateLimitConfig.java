package com.compound.enrichment.ratelimit;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Minimum delay between two calls to the same source.
 *
 * @param defaultInterval interval applied to keys without an override
 * @param overrides       per rate-limit-key intervals
 */
public record RateLimitConfig(Duration defaultInterval, Map<String, Duration> overrides) {

    public RateLimitConfig {
        Objects.requireNonNull(defaultInterval, "defaultInterval is required");
        if (defaultInterval.isNegative()) {
            throw new IllegalArgumentException("defaultInterval must be >= 0");
        }
        overrides = overrides != null ? Map.copyOf(overrides) : Map.of();
        overrides.forEach((key, interval) -> {
            if (interval.isNegative()) {
                throw new IllegalArgumentException("interval for '" + key + "' must be >= 0");
            }
        });
    }

    public Duration intervalFor(String key) {
        return overrides.getOrDefault(key, defaultInterval);
    }

    /**
     * Default configuration: 200ms between calls to any source.
     */
    public static RateLimitConfig defaults() {
        return new RateLimitConfig(Duration.ofMillis(200), Map.of());
    }

    /**
     * No delay at all.
     */
    public static RateLimitConfig unlimited() {
        return new RateLimitConfig(Duration.ZERO, Map.of());
    }
}
