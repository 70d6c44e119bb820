package com.compound.enrichment.metrics;

import com.compound.enrichment.core.model.ItemOutcome;
import com.compound.enrichment.core.model.QualityTier;
import com.compound.enrichment.lookup.LookupAttempt;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLookup(String sourceId, LookupAttempt.Status status, Duration duration) {
    }

    @Override
    public void recordRateLimitWait(String rateLimitKey, Duration waited) {
    }

    @Override
    public void incrementResolution(QualityTier tier) {
    }

    @Override
    public void incrementItemOutcome(ItemOutcome outcome) {
    }

    @Override
    public void recordAggregation(int rawEntries, int uniqueEntries) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
