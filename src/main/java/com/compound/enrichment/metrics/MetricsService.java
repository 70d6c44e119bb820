package com.compound.enrichment.metrics;

import com.compound.enrichment.core.model.ItemOutcome;
import com.compound.enrichment.core.model.QualityTier;
import com.compound.enrichment.lookup.LookupAttempt;

import java.time.Duration;

/**
 * Interface for recording enrichment metrics.
 * The default {@link NoOpMetricsService} does nothing, so the batch runs without any
 * metrics registry configured.
 */
public interface MetricsService {

    void recordLookup(String sourceId, LookupAttempt.Status status, Duration duration);

    void recordRateLimitWait(String rateLimitKey, Duration waited);

    void incrementResolution(QualityTier tier);

    void incrementItemOutcome(ItemOutcome outcome);

    void recordAggregation(int rawEntries, int uniqueEntries);

    void recordCacheHit();

    void recordCacheMiss();
}
