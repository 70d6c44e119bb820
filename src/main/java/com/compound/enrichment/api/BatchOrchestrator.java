package com.compound.enrichment.api;

import com.compound.enrichment.aggregate.EntryAggregator;
import com.compound.enrichment.bulk.ProgressCallback;
import com.compound.enrichment.checkpoint.CheckpointStore;
import com.compound.enrichment.checkpoint.SectionWriter;
import com.compound.enrichment.config.FatalConfigurationException;
import com.compound.enrichment.core.model.AggregatedEntry;
import com.compound.enrichment.core.model.ItemOutcome;
import com.compound.enrichment.core.model.ProcessedItem;
import com.compound.enrichment.core.model.RawEntry;
import com.compound.enrichment.core.model.ResolutionResult;
import com.compound.enrichment.core.model.RunStatistics;
import com.compound.enrichment.core.model.WorkItem;
import com.compound.enrichment.logging.LogContext;
import com.compound.enrichment.metrics.MetricsService;
import com.compound.enrichment.metrics.NoOpMetricsService;
import com.compound.enrichment.resolve.FallbackResolver;
import com.compound.enrichment.source.EntrySource;
import com.compound.enrichment.source.NoOpEntrySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the work set through resolution, entry collection and aggregation, appending one
 * output section per item.
 *
 * <p>The completion set is read from the output log once, at the start. Items it
 * contains are skipped, isolated failures included unless failed items are retried.
 * Every other item is processed in work set order and its section is appended and
 * flushed before the next item starts, so the log is always a valid checkpoint. A fault
 * while processing one item is recorded as an isolated failure and the run continues.
 * A failure to write the log aborts the run.</p>
 *
 * <p>Either stage may be left out: without a resolver only entries are collected,
 * without an entry source only resolution runs.</p>
 *
 * Usage:
 * <pre>
 * BatchOrchestrator orchestrator = BatchOrchestrator.builder()
 *     .resolver(resolver)
 *     .entrySource(wikidata)
 *     .progressCallback((n, total, msg) -&gt; System.out.println(msg))
 *     .build();
 * BatchRunResult result = orchestrator.run(items, Path.of("results.txt"));
 * </pre>
 */
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final FallbackResolver resolver;
    private final CheckpointStore checkpointStore;
    private final EntryAggregator aggregator;
    private final EntrySource entrySource;
    private final MetricsService metrics;
    private final ProgressCallback progressCallback;
    private final boolean retryFailed;

    private BatchOrchestrator(Builder builder) {
        if (builder.resolver == null && builder.entrySource == null) {
            throw new IllegalArgumentException("A resolver or an entry source is required");
        }
        this.resolver = builder.resolver;
        this.checkpointStore = builder.checkpointStore != null ? builder.checkpointStore : new CheckpointStore();
        this.aggregator = builder.aggregator != null ? builder.aggregator : new EntryAggregator();
        this.entrySource = builder.entrySource != null ? builder.entrySource : new NoOpEntrySource();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.progressCallback = builder.progressCallback != null ? builder.progressCallback : ProgressCallback.NOOP;
        this.retryFailed = builder.retryFailed;
    }

    /**
     * Processes every item of the work set that the output log does not already hold.
     *
     * @throws FatalConfigurationException if the output log cannot be read or opened
     * @throws UncheckedIOException        if appending to the output log fails mid-run
     */
    public BatchRunResult run(List<WorkItem> workSet, Path output) {
        Objects.requireNonNull(workSet, "workSet is required");
        Objects.requireNonNull(output, "output is required");

        try (LogContext ctx = LogContext.forRun(LogContext.generateRunId())) {
            Set<String> completed;
            try {
                completed = checkpointStore.computeCompletionSet(output, retryFailed);
            } catch (IOException e) {
                throw new FatalConfigurationException("Output log could not be read: " + output, e);
            }
            log.info("run.started items={} alreadyCompleted={} retryFailed={} output={} entrySource={}",
                    workSet.size(), completed.size(), retryFailed, output, entrySource.getSourceName());

            SectionWriter writer;
            try {
                writer = checkpointStore.openForAppend(output, workSet.size());
            } catch (IOException e) {
                throw new FatalConfigurationException("Output log is not writable: " + output, e);
            }

            StatisticsAccumulator stats = new StatisticsAccumulator();
            List<ProcessedItem> processed = new ArrayList<>();
            boolean interrupted = false;
            long total = workSet.size();

            try (writer) {
                long index = 0;
                for (WorkItem item : workSet) {
                    index++;
                    if (Thread.currentThread().isInterrupted()) {
                        interrupted = true;
                        log.warn("run.interrupted position={} total={}", index, total);
                        break;
                    }
                    if (completed.contains(item.getKey())) {
                        stats.skipped++;
                        metrics.incrementItemOutcome(ItemOutcome.SKIPPED);
                        log.debug("item.skipped key={}", item.getKey());
                        continue;
                    }

                    ProcessedItem result;
                    try (LogContext itemCtx = LogContext.forItem(item.getKey(), index)) {
                        result = processItem(item);
                        append(writer, result);
                    }

                    processed.add(result);
                    stats.record(result);
                    metrics.incrementItemOutcome(result.outcome());
                    if (!result.isFailed() && result.resolution().wasRequested()) {
                        metrics.incrementResolution(result.tier());
                    }
                    progressCallback.onProgress(index, total,
                            "[" + index + "/" + total + "] " + item.getLabel() + " -> " + describe(result));
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close output log " + output, e);
            }

            RunStatistics statistics = stats.toStatistics();
            log.info("run.completed statistics={} interrupted={}", statistics, interrupted);
            return new BatchRunResult(statistics, processed, output, interrupted);
        }
    }

    /**
     * Resolves one item and collects its entries. Any fault becomes an isolated failure.
     */
    ProcessedItem processItem(WorkItem item) {
        try {
            ResolutionResult resolution = resolver != null ? resolver.resolve(item) : ResolutionResult.notRequested();
            List<RawEntry> raw = entrySource.fetch(item);
            List<AggregatedEntry> entries = aggregator.aggregate(raw);
            metrics.recordAggregation(raw.size(), entries.size());
            log.info("item.processed tier={} source={} entries={} rawEntries={}",
                    resolution.tier(), resolution.sourceId(), entries.size(), raw.size());
            return ProcessedItem.resolved(item, resolution, entries);
        } catch (Exception e) {
            log.warn("item.failed key={} error={}", item.getKey(), e.toString());
            return ProcessedItem.failed(item, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static void append(SectionWriter writer, ProcessedItem result) {
        try {
            writer.append(result);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append section for item " + result.item().getKey(), e);
        }
    }

    private static String describe(ProcessedItem result) {
        if (result.isFailed()) {
            return "FAILED";
        }
        if (!result.resolution().wasRequested()) {
            return result.entries().size() + " entries";
        }
        return result.tier().name() + (result.entries().isEmpty() ? "" : " (" + result.entries().size() + " entries)");
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class StatisticsAccumulator {
        long full;
        long degraded;
        long unresolved;
        long failed;
        long skipped;

        void record(ProcessedItem result) {
            if (result.isFailed()) {
                failed++;
                return;
            }
            switch (result.tier()) {
                case FULL -> full++;
                case DEGRADED -> degraded++;
                case UNRESOLVED -> unresolved++;
            }
        }

        RunStatistics toStatistics() {
            return new RunStatistics(full + degraded + unresolved + failed, full, degraded, unresolved, failed, skipped);
        }
    }

    public static class Builder {
        private FallbackResolver resolver;
        private CheckpointStore checkpointStore;
        private EntryAggregator aggregator;
        private EntrySource entrySource;
        private MetricsService metrics;
        private ProgressCallback progressCallback;
        private boolean retryFailed;

        public Builder resolver(FallbackResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder aggregator(EntryAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder entrySource(EntrySource entrySource) {
            this.entrySource = entrySource;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        /**
         * Processes items again whose latest section records an isolated failure.
         * Off by default: a persisted failure counts as done.
         */
        public Builder retryFailed(boolean retryFailed) {
            this.retryFailed = retryFailed;
            return this;
        }

        public BatchOrchestrator build() {
            return new BatchOrchestrator(this);
        }
    }
}
