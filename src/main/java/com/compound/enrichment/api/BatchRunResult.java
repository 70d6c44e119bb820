package com.compound.enrichment.api;

import com.compound.enrichment.core.model.ProcessedItem;
import com.compound.enrichment.core.model.RunStatistics;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one orchestrator run.
 *
 * @param statistics  counters for this run only
 * @param processed   items processed in this run, in work set order; feeds the tabular export
 * @param output      the output log that was appended to
 * @param interrupted true if the run stopped early because the thread was interrupted
 */
public record BatchRunResult(
        RunStatistics statistics,
        List<ProcessedItem> processed,
        Path output,
        boolean interrupted
) {
    public BatchRunResult {
        processed = processed != null ? List.copyOf(processed) : List.of();
    }

    @Override
    public String toString() {
        return "BatchRunResult{" + statistics + ", output=" + output +
                (interrupted ? ", interrupted" : "") + '}';
    }
}
