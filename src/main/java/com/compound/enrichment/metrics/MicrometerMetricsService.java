package com.compound.enrichment.metrics;

import com.compound.enrichment.core.model.ItemOutcome;
import com.compound.enrichment.core.model.QualityTier;
import com.compound.enrichment.lookup.LookupAttempt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code enrichment.lookup.duration} - Timer (tags: source, status)</li>
 *   <li>{@code enrichment.ratelimit.wait} - Timer (tag: key)</li>
 *   <li>{@code enrichment.resolution} - Counter (tag: tier)</li>
 *   <li>{@code enrichment.item} - Counter (tag: outcome)</li>
 *   <li>{@code enrichment.entries.raw} / {@code enrichment.entries.unique} - DistributionSummary</li>
 *   <li>{@code enrichment.cache.hit} / {@code enrichment.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary rawEntriesSummary;
    private final DistributionSummary uniqueEntriesSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.rawEntriesSummary = DistributionSummary.builder("enrichment.entries.raw")
                .description("Raw entries reported per item before deduplication")
                .register(registry);
        this.uniqueEntriesSummary = DistributionSummary.builder("enrichment.entries.unique")
                .description("Entries per item after deduplication")
                .register(registry);
        this.cacheHitCounter = Counter.builder("enrichment.cache.hit")
                .description("Lookups answered from the cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("enrichment.cache.miss")
                .description("Lookups that had to call the source")
                .register(registry);
    }

    @Override
    public void recordLookup(String sourceId, LookupAttempt.Status status, Duration duration) {
        String key = "lookup:" + sourceId + ":" + status.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("enrichment.lookup.duration")
                        .description("Duration of calls to lookup sources")
                        .tag("source", sourceId)
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRateLimitWait(String rateLimitKey, Duration waited) {
        String key = "wait:" + rateLimitKey;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("enrichment.ratelimit.wait")
                        .description("Time spent waiting for the rate limiter")
                        .tag("key", rateLimitKey)
                        .register(registry));
        timer.record(waited);
    }

    @Override
    public void incrementResolution(QualityTier tier) {
        String key = "tier:" + tier.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("enrichment.resolution")
                        .description("Resolved items by quality tier")
                        .tag("tier", tier.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementItemOutcome(ItemOutcome outcome) {
        String key = "outcome:" + outcome.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("enrichment.item")
                        .description("Work items by outcome")
                        .tag("outcome", outcome.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordAggregation(int rawEntries, int uniqueEntries) {
        rawEntriesSummary.record(rawEntries);
        uniqueEntriesSummary.record(uniqueEntries);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
