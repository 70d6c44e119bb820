package com.compound.enrichment.resolve;

import com.compound.enrichment.core.model.QualityTier;
import com.compound.enrichment.core.model.WorkItem;
import com.compound.enrichment.lookup.LookupSource;
import com.compound.enrichment.lookup.QualityPredicate;

import java.util.Objects;
import java.util.function.Function;

/**
 * One position of the fallback chain: which source to call, which hint of the work item
 * to query it with, and how to grade what comes back.
 *
 * <p>A refinement step belongs to the same source family as an earlier step and only
 * fires when a degraded candidate is already held, to look for a complete one.</p>
 */
public final class FallbackStep {

    private final LookupSource source;
    private final Function<WorkItem, String> keyExtractor;
    private final QualityPredicate predicate;
    private final boolean refinement;

    private FallbackStep(LookupSource source, Function<WorkItem, String> keyExtractor,
                         QualityPredicate predicate, boolean refinement) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.keyExtractor = Objects.requireNonNull(keyExtractor, "keyExtractor is required");
        this.predicate = Objects.requireNonNull(predicate, "predicate is required");
        this.refinement = refinement;
    }

    public static FallbackStep of(LookupSource source, Function<WorkItem, String> keyExtractor,
                                  QualityPredicate predicate) {
        return new FallbackStep(source, keyExtractor, predicate, false);
    }

    public static FallbackStep refinement(LookupSource source, Function<WorkItem, String> keyExtractor,
                                          QualityPredicate predicate) {
        return new FallbackStep(source, keyExtractor, predicate, true);
    }

    /**
     * Returns the query key for this item, or null when the item has no usable hint.
     */
    String queryKey(WorkItem item) {
        String key = keyExtractor.apply(item);
        return key == null || key.isBlank() ? null : key.trim();
    }

    /**
     * Grades a value, capped at what the source advertises.
     */
    QualityTier classify(String value) {
        QualityTier tier = predicate.classify(value);
        return QualityTier.min(tier != null ? tier : QualityTier.UNRESOLVED, source.maxTier());
    }

    public LookupSource getSource() {
        return source;
    }

    public boolean isRefinement() {
        return refinement;
    }

    @Override
    public String toString() {
        return "FallbackStep{" + source.getSourceId() + (refinement ? ", refinement" : "") + '}';
    }
}
