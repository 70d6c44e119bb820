package com.compound.enrichment.resolve;

import com.compound.enrichment.cache.CachedLookup;
import com.compound.enrichment.cache.LookupCache;
import com.compound.enrichment.cache.NoOpLookupCache;
import com.compound.enrichment.core.model.QualityTier;
import com.compound.enrichment.core.model.ResolutionResult;
import com.compound.enrichment.core.model.UnresolvedReason;
import com.compound.enrichment.core.model.WorkItem;
import com.compound.enrichment.lookup.LookupAttempt;
import com.compound.enrichment.lookup.LookupSource;
import com.compound.enrichment.lookup.SourceUnavailableException;
import com.compound.enrichment.metrics.MetricsService;
import com.compound.enrichment.metrics.NoOpMetricsService;
import com.compound.enrichment.ratelimit.RateLimitConfig;
import com.compound.enrichment.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the canonical identifier of a work item by walking an ordered chain of
 * lookup sources.
 *
 * <p>The chain stops at the first value whose tier reaches the target tier (FULL by
 * default). Lower-tier values are remembered and the first one found is returned if
 * nothing better turns up. Source failures never escape: a source that fails simply
 * contributes nothing. Items without any usable hint resolve to UNRESOLVED without
 * calling a source.</p>
 *
 * Usage:
 * <pre>
 * FallbackResolver resolver = FallbackResolver.builder()
 *     .step(FallbackStep.of(byInchiKey, WorkItem::getSecondaryKey, new StereoChemistryPredicate()))
 *     .step(FallbackStep.of(byName, WorkItem::getLabel, new StereoChemistryPredicate()))
 *     .rateLimiter(rateLimiter)
 *     .build();
 * </pre>
 */
public class FallbackResolver {
    private static final Logger log = LoggerFactory.getLogger(FallbackResolver.class);

    private final List<FallbackStep> steps;
    private final RateLimiter rateLimiter;
    private final LookupCache cache;
    private final MetricsService metrics;
    private final QualityTier targetTier;

    private FallbackResolver(Builder builder) {
        if (builder.steps.isEmpty()) {
            throw new IllegalArgumentException("At least one fallback step is required");
        }
        if (builder.targetTier == QualityTier.UNRESOLVED) {
            throw new IllegalArgumentException("targetTier must be DEGRADED or FULL");
        }
        this.steps = List.copyOf(builder.steps);
        this.rateLimiter = builder.rateLimiter != null
                ? builder.rateLimiter : new RateLimiter(RateLimitConfig.defaults());
        this.cache = builder.cache != null ? builder.cache : new NoOpLookupCache();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.targetTier = builder.targetTier;
    }

    /**
     * Resolves one item. Never throws for source failures.
     */
    public ResolutionResult resolve(WorkItem item) {
        Objects.requireNonNull(item, "item is required");
        List<PreparedCall> calls = new ArrayList<>();
        for (FallbackStep step : steps) {
            String key = step.queryKey(item);
            if (key != null) {
                calls.add(new PreparedCall(step, key));
            }
        }
        if (calls.isEmpty()) {
            log.debug("resolve.no_hints item={}", item.getKey());
            return ResolutionResult.unresolved(UnresolvedReason.NO_HINTS);
        }

        ResolutionResult result = select(calls, targetTier, this::call);
        log.debug("resolve.completed item={} tier={} source={}",
                item.getKey(), result.tier(), result.sourceId());
        return result;
    }

    /**
     * Walks the prepared calls in order and picks the best answer.
     * Pure apart from the invoker: the same attempts always yield the same result.
     */
    static ResolutionResult select(List<PreparedCall> calls, QualityTier targetTier,
                                   Function<PreparedCall, LookupAttempt> invoker) {
        ResolutionResult best = null;
        boolean sawUnavailable = false;

        for (PreparedCall call : calls) {
            if (call.step().isRefinement() && best == null) {
                continue;
            }
            LookupAttempt attempt = invoker.apply(call);
            switch (attempt.status()) {
                case FOUND -> {
                    QualityTier tier = call.step().classify(attempt.value());
                    if (tier == QualityTier.UNRESOLVED) {
                        continue;
                    }
                    ResolutionResult candidate = ResolutionResult.of(attempt.value(), tier, attempt.sourceId());
                    if (tier.isAtLeast(targetTier)) {
                        return candidate;
                    }
                    if (best == null || tier.compareTo(best.tier()) > 0) {
                        best = candidate;
                    }
                }
                case UNAVAILABLE -> sawUnavailable = true;
                case NOT_FOUND -> {
                }
            }
        }

        if (best != null) {
            return best;
        }
        return ResolutionResult.unresolved(sawUnavailable
                ? UnresolvedReason.SOURCE_UNAVAILABLE
                : UnresolvedReason.NOT_FOUND);
    }

    private LookupAttempt call(PreparedCall call) {
        LookupSource source = call.step().getSource();
        String sourceId = source.getSourceId();

        Optional<CachedLookup> cached = cache.get(sourceId, call.key());
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get().isFound()
                    ? LookupAttempt.found(sourceId, cached.get().value())
                    : LookupAttempt.notFound(sourceId);
        }
        metrics.recordCacheMiss();

        Duration waited = rateLimiter.acquire(source.getRateLimitKey());
        metrics.recordRateLimitWait(source.getRateLimitKey(), waited);

        long started = System.nanoTime();
        LookupAttempt attempt;
        try {
            Optional<String> value = source.lookup(call.key());
            attempt = value.filter(v -> !v.isBlank())
                    .map(v -> LookupAttempt.found(sourceId, v))
                    .orElseGet(() -> LookupAttempt.notFound(sourceId));
        } catch (SourceUnavailableException e) {
            log.warn("lookup.unavailable source={} key='{}' error={}", sourceId, call.key(), e.getMessage());
            attempt = LookupAttempt.unavailable(sourceId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("lookup.failed source={} key='{}' error={}", sourceId, call.key(), e.toString());
            attempt = LookupAttempt.unavailable(sourceId, e.toString());
        }
        metrics.recordLookup(sourceId, attempt.status(), Duration.ofNanos(System.nanoTime() - started));

        if (attempt.isDefinitive()) {
            cache.put(sourceId, call.key(), attempt.isFound()
                    ? CachedLookup.found(attempt.value())
                    : CachedLookup.notFound());
        }
        log.debug("lookup.completed source={} key='{}' status={}", sourceId, call.key(), attempt.status());
        return attempt;
    }

    public List<FallbackStep> getSteps() {
        return steps;
    }

    public QualityTier getTargetTier() {
        return targetTier;
    }

    /**
     * A step together with the key it will be queried with for the current item.
     */
    record PreparedCall(FallbackStep step, String key) {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<FallbackStep> steps = new ArrayList<>();
        private RateLimiter rateLimiter;
        private LookupCache cache;
        private MetricsService metrics;
        private QualityTier targetTier = QualityTier.FULL;

        public Builder step(FallbackStep step) {
            steps.add(Objects.requireNonNull(step, "step is required"));
            return this;
        }

        public Builder steps(List<FallbackStep> steps) {
            steps.forEach(this::step);
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder cache(LookupCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder targetTier(QualityTier targetTier) {
            this.targetTier = Objects.requireNonNull(targetTier, "targetTier is required");
            return this;
        }

        public FallbackResolver build() {
            return new FallbackResolver(this);
        }
    }
}
