package com.compound.enrichment.app;

import com.compound.enrichment.api.BatchRunResult;
import com.compound.enrichment.bulk.ExportResult;
import com.compound.enrichment.bulk.LoadResult;
import com.compound.enrichment.config.EnrichmentSettings;
import com.compound.enrichment.config.FatalConfigurationException;
import com.compound.enrichment.core.model.RunStatistics;
import com.compound.enrichment.metrics.MetricsService;
import com.compound.enrichment.metrics.MicrometerMetricsService;
import com.compound.enrichment.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Command line entry point. Reads {@code enrichment.*} settings, runs the batch against
 * the configured output log, then writes the tabular export.
 *
 * <pre>
 * java -Denrichment.work-set.path=compounds.json \
 *      -Denrichment.output.path=results.txt \
 *      -jar compound-enrichment.jar
 * </pre>
 *
 * <p>Exit status: 0 on success, 1 when the run could not start, 2 when it aborted
 * mid-way or the export failed, 130 when interrupted. Rerunning with the same settings
 * resumes where the previous run stopped.</p>
 */
public final class BatchEnrichmentApplication {
    private static final Logger log = LoggerFactory.getLogger(BatchEnrichmentApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL_CONFIGURATION = 1;
    static final int EXIT_ABORTED = 2;
    static final int EXIT_INTERRUPTED = 130;

    private BatchEnrichmentApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(ConfigProvider.getConfig()));
    }

    static int run(Config config) {
        EnrichmentSettings settings;
        try {
            settings = EnrichmentSettings.from(config);
        } catch (FatalConfigurationException e) {
            log.error("run.fatal error={}", e.getMessage());
            return EXIT_FATAL_CONFIGURATION;
        }
        log.info("run.configured settings={}", settings);

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsService metrics = settings.isMetricsEnabled()
                ? new MicrometerMetricsService(registry)
                : new NoOpMetricsService();
        EnrichmentComponents components = EnrichmentComponents.create(settings, metrics,
                (position, total, message) -> log.info("item.progress {}", message));

        BatchRunResult result;
        try {
            LoadResult workSet = components.getWorkSetReader().read(settings.getWorkSetPath());
            if (workSet.hasErrors()) {
                log.warn("workset.errors count={}", workSet.errors().size());
            }
            result = components.getOrchestrator().run(workSet.items(), settings.getOutputPath());
        } catch (FatalConfigurationException e) {
            log.error("run.fatal error={}", e.getMessage());
            return EXIT_FATAL_CONFIGURATION;
        } catch (UncheckedIOException e) {
            log.error("run.aborted error={}", e.getMessage(), e);
            return EXIT_ABORTED;
        }

        try {
            ExportResult export = components.getExporter().export(result.processed(), settings.getExportPath());
            log.info("export.written result={}", export);
        } catch (IOException e) {
            log.error("export.failed target={} error={}", settings.getExportPath(), e.getMessage(), e);
            logSummary(result.statistics(), components);
            return EXIT_ABORTED;
        }

        logSummary(result.statistics(), components);
        if (settings.isMetricsEnabled()) {
            registry.getMeters().forEach(meter -> log.debug("metrics.meter id={} values={}",
                    meter.getId(), meter.measure()));
        }
        return result.interrupted() ? EXIT_INTERRUPTED : EXIT_OK;
    }

    private static void logSummary(RunStatistics stats, EnrichmentComponents components) {
        log.info("run.summary processed={} full={} degraded={} unresolved={} failed={} skipped={} cache={}",
                stats.totalProcessed(), stats.full(), stats.degraded(), stats.unresolved(),
                stats.failed(), stats.skipped(), components.getLookupCache().getStats());
    }
}
