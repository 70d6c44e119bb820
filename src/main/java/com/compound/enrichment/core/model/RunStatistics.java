package com.compound.enrichment.core.model;

/**
 * Counters for one orchestrator run.
 *
 * @param totalProcessed items processed in this run (resolved or failed)
 * @param full           items resolved at {@link QualityTier#FULL}
 * @param degraded       items resolved at {@link QualityTier#DEGRADED}
 * @param unresolved     items processed without a value
 * @param failed         items whose processing failed and was isolated
 * @param skipped        items skipped because a previous run completed them
 */
public record RunStatistics(
        long totalProcessed,
        long full,
        long degraded,
        long unresolved,
        long failed,
        long skipped
) {
    public RunStatistics {
        if (totalProcessed < 0 || full < 0 || degraded < 0 || unresolved < 0 || failed < 0 || skipped < 0) {
            throw new IllegalArgumentException("Counters must be >= 0");
        }
        if (full + degraded + unresolved + failed != totalProcessed) {
            throw new IllegalArgumentException("Outcome counters must add up to totalProcessed");
        }
    }

    public static RunStatistics empty() {
        return new RunStatistics(0, 0, 0, 0, 0, 0);
    }

    public long resolvedCount() {
        return full + degraded;
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    @Override
    public String toString() {
        return "RunStatistics{total=" + totalProcessed +
                ", full=" + full +
                ", degraded=" + degraded +
                ", unresolved=" + unresolved +
                ", failed=" + failed +
                ", skipped=" + skipped + '}';
    }
}
