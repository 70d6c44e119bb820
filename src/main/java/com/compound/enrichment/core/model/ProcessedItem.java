package com.compound.enrichment.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A work item together with everything this run learned about it. Rendered into one
 * output section and one export row.
 */
public record ProcessedItem(
        WorkItem item,
        ItemOutcome outcome,
        ResolutionResult resolution,
        List<AggregatedEntry> entries,
        String failureMessage
) {
    public ProcessedItem {
        Objects.requireNonNull(item, "item is required");
        Objects.requireNonNull(outcome, "outcome is required");
        if (outcome == ItemOutcome.SKIPPED) {
            throw new IllegalArgumentException("Skipped items are never rendered");
        }
        if (outcome == ItemOutcome.RESOLVED) {
            Objects.requireNonNull(resolution, "resolution is required for processed items");
        }
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static ProcessedItem resolved(WorkItem item, ResolutionResult resolution, List<AggregatedEntry> entries) {
        return new ProcessedItem(item, ItemOutcome.RESOLVED, resolution, entries, null);
    }

    public static ProcessedItem failed(WorkItem item, String failureMessage) {
        return new ProcessedItem(item, ItemOutcome.FAILED_ISOLATED, null, List.of(),
                failureMessage != null ? failureMessage : "unknown error");
    }

    public boolean isFailed() {
        return outcome == ItemOutcome.FAILED_ISOLATED;
    }

    /**
     * Tier reached by this item; failed items count as unresolved.
     */
    public QualityTier tier() {
        return resolution != null ? resolution.tier() : QualityTier.UNRESOLVED;
    }
}
