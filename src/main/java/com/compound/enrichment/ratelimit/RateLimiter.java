package com.compound.enrichment.ratelimit;

import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Enforces a minimum interval between calls to the same source.
 *
 * <p>One instance is shared by every lookup in the process and owns the last-call
 * timestamp of each rate-limit key. Callers are served in arrival order; the batch
 * runs a single worker, so there is no contention beyond that.</p>
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitConfig config;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final Map<String, Long> lastAcquiredNanos = new HashMap<>();

    public RateLimiter(RateLimitConfig config) {
        this(config, Ticker.systemTicker(), Sleeper.SYSTEM);
    }

    public RateLimiter(RateLimitConfig config, Ticker ticker, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.ticker = Objects.requireNonNull(ticker, "ticker is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
    }

    /**
     * Blocks until the configured interval has elapsed since the previous acquire for the
     * same key, then records this call.
     *
     * <p>If the thread is interrupted while waiting, the interrupt flag is restored and
     * the call proceeds without the remaining delay.</p>
     *
     * @param key the rate-limit key of the source about to be called
     * @return how long the caller waited
     */
    public synchronized Duration acquire(String key) {
        Objects.requireNonNull(key, "key is required");
        long intervalNanos = config.intervalFor(key).toNanos();
        Long last = lastAcquiredNanos.get(key);
        long waitNanos = 0L;

        if (last != null && intervalNanos > 0) {
            long elapsed = ticker.read() - last;
            waitNanos = Math.max(0L, intervalNanos - elapsed);
        }
        if (waitNanos > 0) {
            try {
                log.trace("ratelimit.wait key={} waitMs={}", key, waitNanos / 1_000_000);
                sleeper.sleep(Duration.ofNanos(waitNanos));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("ratelimit.interrupted key={}", key);
            }
        }

        lastAcquiredNanos.put(key, ticker.read());
        return Duration.ofNanos(waitNanos);
    }

    /**
     * Returns the interval configured for a key.
     */
    public Duration intervalFor(String key) {
        return config.intervalFor(key);
    }
}
