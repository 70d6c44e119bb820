package com.compound.enrichment.app;

import com.compound.enrichment.api.BatchOrchestrator;
import com.compound.enrichment.bulk.CsvTabularExporter;
import com.compound.enrichment.bulk.CsvWorkSetReader;
import com.compound.enrichment.bulk.JsonWorkSetReader;
import com.compound.enrichment.bulk.ProgressCallback;
import com.compound.enrichment.bulk.TabularExporter;
import com.compound.enrichment.bulk.WorkSetReader;
import com.compound.enrichment.cache.CaffeineLookupCache;
import com.compound.enrichment.cache.LookupCache;
import com.compound.enrichment.checkpoint.CheckpointStore;
import com.compound.enrichment.config.EnrichmentSettings;
import com.compound.enrichment.core.model.WorkItem;
import com.compound.enrichment.lookup.PubChemLookupSource;
import com.compound.enrichment.lookup.QualityPredicate;
import com.compound.enrichment.lookup.StereoChemistryPredicate;
import com.compound.enrichment.metrics.MetricsService;
import com.compound.enrichment.ratelimit.RateLimiter;
import com.compound.enrichment.resolve.FallbackResolver;
import com.compound.enrichment.resolve.FallbackStep;
import com.compound.enrichment.source.EntrySource;
import com.compound.enrichment.source.NoOpEntrySource;
import com.compound.enrichment.source.ReferenceMetadataClient;
import com.compound.enrichment.source.WikidataEntrySource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Wires the batch components from {@link EnrichmentSettings}.
 *
 * <p>The default chain asks PubChem by InChIKey first and by compound name second, grading
 * both answers with {@link StereoChemistryPredicate}. Both steps share the {@code pubchem}
 * rate limit. Each stage can be switched off: a plant work set runs with PubChem disabled
 * and Wikidata enabled, a compound work set the other way round.</p>
 */
public final class EnrichmentComponents {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentComponents.class);

    private final RateLimiter rateLimiter;
    private final LookupCache lookupCache;
    private final FallbackResolver resolver;
    private final EntrySource entrySource;
    private final BatchOrchestrator orchestrator;
    private final WorkSetReader workSetReader;
    private final TabularExporter exporter;

    private EnrichmentComponents(RateLimiter rateLimiter, LookupCache lookupCache, FallbackResolver resolver,
                                 EntrySource entrySource, BatchOrchestrator orchestrator,
                                 WorkSetReader workSetReader, TabularExporter exporter) {
        this.rateLimiter = rateLimiter;
        this.lookupCache = lookupCache;
        this.resolver = resolver;
        this.entrySource = entrySource;
        this.orchestrator = orchestrator;
        this.workSetReader = workSetReader;
        this.exporter = exporter;
    }

    public static EnrichmentComponents create(EnrichmentSettings settings, MetricsService metrics,
                                              ProgressCallback progressCallback) {
        return create(settings, metrics, progressCallback, Clock.systemDefaultZone());
    }

    public static EnrichmentComponents create(EnrichmentSettings settings, MetricsService metrics,
                                              ProgressCallback progressCallback, Clock clock) {
        RateLimiter rateLimiter = new RateLimiter(settings.getRateLimitConfig());
        LookupCache lookupCache = CaffeineLookupCache.create(settings.getCacheConfig());

        FallbackResolver resolver = settings.isPubchemEnabled()
                ? FallbackResolver.builder()
                        .steps(defaultChain(settings))
                        .rateLimiter(rateLimiter)
                        .cache(lookupCache)
                        .metrics(metrics)
                        .targetTier(settings.getTargetTier())
                        .build()
                : null;

        EntrySource entrySource = settings.isWikidataEnabled()
                ? WikidataEntrySource.builder()
                        .sparqlUrl(settings.getWikidataSparqlUrl())
                        .timeout(settings.getWikidataTimeout())
                        .userAgent(settings.getUserAgent())
                        .rateLimiter(rateLimiter)
                        .referenceClient(new ReferenceMetadataClient(settings.getWikidataEntityUrl(),
                                settings.getHttpTimeout(), settings.getUserAgent(), rateLimiter,
                                settings.getCacheConfig()))
                        .build()
                : new NoOpEntrySource();

        BatchOrchestrator orchestrator = BatchOrchestrator.builder()
                .resolver(resolver)
                .checkpointStore(new CheckpointStore(clock))
                .entrySource(entrySource)
                .metrics(metrics)
                .progressCallback(progressCallback)
                .retryFailed(settings.isRetryFailed())
                .build();

        WorkSetReader reader = switch (settings.getWorkSetFormat()) {
            case CSV -> new CsvWorkSetReader(settings.isCsvHeader(), settings.getMaxItems(),
                    settings.getSynonymSeparator());
            case JSON -> new JsonWorkSetReader(new ObjectMapper(), settings.getMaxItems(),
                    settings.getSynonymSeparator());
        };

        log.info("components.created chain={} entrySource={} workSetFormat={}",
                resolver != null ? resolver.getSteps() : "none", entrySource.getSourceName(), reader.getFormat());
        return new EnrichmentComponents(rateLimiter, lookupCache, resolver, entrySource, orchestrator,
                reader, new CsvTabularExporter());
    }

    /**
     * PubChem by InChIKey, then PubChem by name.
     */
    static List<FallbackStep> defaultChain(EnrichmentSettings settings) {
        QualityPredicate stereo = new StereoChemistryPredicate();
        PubChemLookupSource byInchiKey = PubChemLookupSource.builder()
                .baseUrl(settings.getPubchemBaseUrl())
                .queryBy(PubChemLookupSource.Namespace.INCHIKEY)
                .timeout(settings.getHttpTimeout())
                .userAgent(settings.getUserAgent())
                .build();
        PubChemLookupSource byName = PubChemLookupSource.builder()
                .baseUrl(settings.getPubchemBaseUrl())
                .queryBy(PubChemLookupSource.Namespace.NAME)
                .timeout(settings.getHttpTimeout())
                .userAgent(settings.getUserAgent())
                .build();
        return List.of(
                FallbackStep.of(byInchiKey, WorkItem::getSecondaryKey, stereo),
                FallbackStep.of(byName, WorkItem::getLabel, stereo));
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public LookupCache getLookupCache() {
        return lookupCache;
    }

    /**
     * The lookup chain, empty when PubChem is disabled.
     */
    public Optional<FallbackResolver> getResolver() {
        return Optional.ofNullable(resolver);
    }

    public EntrySource getEntrySource() {
        return entrySource;
    }

    public BatchOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public WorkSetReader getWorkSetReader() {
        return workSetReader;
    }

    public TabularExporter getExporter() {
        return exporter;
    }
}
