package com.compound.enrichment.config;

import com.compound.enrichment.cache.CacheConfig;
import com.compound.enrichment.core.model.QualityTier;
import com.compound.enrichment.lookup.PubChemLookupSource;
import com.compound.enrichment.ratelimit.RateLimitConfig;
import com.compound.enrichment.source.ReferenceMetadataClient;
import com.compound.enrichment.source.WikidataEntrySource;
import org.eclipse.microprofile.config.Config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of a batch run, read from MicroProfile Config properties under {@code enrichment.*}.
 *
 * <pre>
 * enrichment.work-set.path=plants.csv
 * enrichment.output.path=results.txt
 * enrichment.rate-limit.pubchem-ms=200
 * enrichment.pubchem.enabled=false
 * enrichment.wikidata.enabled=true
 * </pre>
 *
 * <p>Defaults live in {@code META-INF/microprofile-config.properties}; system properties
 * and environment variables ({@code ENRICHMENT_WORK_SET_PATH}) override them.</p>
 */
public final class EnrichmentSettings {

    public enum WorkSetFormat { CSV, JSON }

    private final Path workSetPath;
    private final WorkSetFormat workSetFormat;
    private final boolean csvHeader;
    private final int maxItems;
    private final String synonymSeparator;
    private final Path outputPath;
    private final Path exportPath;
    private final RateLimitConfig rateLimitConfig;
    private final Duration httpTimeout;
    private final String userAgent;
    private final String pubchemBaseUrl;
    private final boolean pubchemEnabled;
    private final boolean wikidataEnabled;
    private final String wikidataSparqlUrl;
    private final String wikidataEntityUrl;
    private final Duration wikidataTimeout;
    private final CacheConfig cacheConfig;
    private final QualityTier targetTier;
    private final boolean metricsEnabled;
    private final boolean retryFailed;

    private EnrichmentSettings(Config config) {
        // ── Work set ──────────────────────────────────────────
        this.workSetPath = Path.of(required(config, "enrichment.work-set.path"));
        this.workSetFormat = config.getOptionalValue("enrichment.work-set.format", String.class)
                .map(EnrichmentSettings::parseFormat)
                .orElseGet(() -> inferFormat(workSetPath));
        this.csvHeader = config.getOptionalValue("enrichment.work-set.csv-header", Boolean.class).orElse(false);
        this.maxItems = config.getOptionalValue("enrichment.work-set.max-items", Integer.class).orElse(0);
        String synonymWord = config.getOptionalValue("enrichment.work-set.synonym-word", String.class).orElse("or");
        this.synonymSeparator = " " + synonymWord.trim() + " ";

        // ── Output ────────────────────────────────────────────
        this.outputPath = Path.of(required(config, "enrichment.output.path"));
        this.exportPath = config.getOptionalValue("enrichment.export.path", String.class)
                .map(Path::of)
                .orElseGet(() -> siblingWithExtension(outputPath, ".csv"));

        // ── Rate limiting ─────────────────────────────────────
        Duration defaultInterval = millis(config, "enrichment.rate-limit.default-ms", 200);
        this.rateLimitConfig = new RateLimitConfig(defaultInterval, Map.of(
                PubChemLookupSource.RATE_LIMIT_KEY,
                millis(config, "enrichment.rate-limit.pubchem-ms", defaultInterval.toMillis()),
                WikidataEntrySource.RATE_LIMIT_KEY,
                millis(config, "enrichment.rate-limit.wikidata-sparql-ms", 300),
                ReferenceMetadataClient.RATE_LIMIT_KEY,
                millis(config, "enrichment.rate-limit.wikidata-entity-ms", defaultInterval.toMillis())));

        // ── HTTP ──────────────────────────────────────────────
        this.httpTimeout = seconds(config, "enrichment.http.timeout-seconds", 10);
        this.userAgent = config.getOptionalValue("enrichment.http.user-agent", String.class)
                .orElse("compound-enrichment/1.0");

        // ── Sources ───────────────────────────────────────────
        this.pubchemBaseUrl = config.getOptionalValue("enrichment.pubchem.base-url", String.class)
                .orElse(PubChemLookupSource.DEFAULT_BASE_URL);
        this.pubchemEnabled = config.getOptionalValue("enrichment.pubchem.enabled", Boolean.class).orElse(true);
        this.wikidataEnabled = config.getOptionalValue("enrichment.wikidata.enabled", Boolean.class).orElse(false);
        if (!pubchemEnabled && !wikidataEnabled) {
            throw new IllegalArgumentException("enrichment.pubchem.enabled and enrichment.wikidata.enabled are both false");
        }
        this.wikidataSparqlUrl = config.getOptionalValue("enrichment.wikidata.sparql-url", String.class)
                .orElse(WikidataEntrySource.DEFAULT_SPARQL_URL);
        this.wikidataEntityUrl = config.getOptionalValue("enrichment.wikidata.entity-url", String.class)
                .orElse(ReferenceMetadataClient.DEFAULT_ENTITY_URL);
        this.wikidataTimeout = seconds(config, "enrichment.wikidata.timeout-seconds", 60);

        // ── Cache ─────────────────────────────────────────────
        boolean cacheEnabled = config.getOptionalValue("enrichment.cache.enabled", Boolean.class).orElse(true);
        this.cacheConfig = cacheEnabled
                ? new CacheConfig(
                        config.getOptionalValue("enrichment.cache.max-size", Integer.class).orElse(10_000),
                        config.getOptionalValue("enrichment.cache.ttl-seconds", Integer.class).orElse(86_400),
                        true)
                : CacheConfig.disabled();

        // ── Resolution ────────────────────────────────────────
        this.targetTier = config.getOptionalValue("enrichment.resolution.target-tier", String.class)
                .map(EnrichmentSettings::parseTier)
                .orElse(QualityTier.FULL);

        this.metricsEnabled = config.getOptionalValue("enrichment.metrics.enabled", Boolean.class).orElse(true);
        this.retryFailed = config.getOptionalValue("enrichment.resume.retry-failed", Boolean.class).orElse(false);
    }

    /**
     * Reads and validates the settings.
     *
     * @throws FatalConfigurationException if a required key is missing or a value is invalid
     */
    public static EnrichmentSettings from(Config config) {
        try {
            return new EnrichmentSettings(config);
        } catch (FatalConfigurationException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new FatalConfigurationException("Invalid enrichment settings: " + e.getMessage(), e);
        }
    }

    private static String required(Config config, String name) {
        Optional<String> value = config.getOptionalValue(name, String.class);
        if (value.isEmpty() || value.get().isBlank()) {
            throw new FatalConfigurationException("Missing required setting " + name);
        }
        return value.get().trim();
    }

    private static Duration millis(Config config, String name, long defaultValue) {
        long value = config.getOptionalValue(name, Long.class).orElse(defaultValue);
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return Duration.ofMillis(value);
    }

    private static Duration seconds(Config config, String name, long defaultValue) {
        long value = config.getOptionalValue(name, Long.class).orElse(defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return Duration.ofSeconds(value);
    }

    static WorkSetFormat parseFormat(String value) {
        try {
            return WorkSetFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported work set format '" + value + "'", e);
        }
    }

    static WorkSetFormat inferFormat(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString().toLowerCase(Locale.ROOT) : "";
        return name.endsWith(".json") ? WorkSetFormat.JSON : WorkSetFormat.CSV;
    }

    static QualityTier parseTier(String value) {
        QualityTier tier;
        try {
            tier = QualityTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown quality tier '" + value + "'", e);
        }
        if (tier == QualityTier.UNRESOLVED) {
            throw new IllegalArgumentException("target tier must be DEGRADED or FULL");
        }
        return tier;
    }

    static Path siblingWithExtension(Path path, String extension) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return path.resolveSibling(base + extension);
    }

    public Path getWorkSetPath() {
        return workSetPath;
    }

    public WorkSetFormat getWorkSetFormat() {
        return workSetFormat;
    }

    public boolean isCsvHeader() {
        return csvHeader;
    }

    public int getMaxItems() {
        return maxItems;
    }

    public String getSynonymSeparator() {
        return synonymSeparator;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public Path getExportPath() {
        return exportPath;
    }

    public RateLimitConfig getRateLimitConfig() {
        return rateLimitConfig;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getPubchemBaseUrl() {
        return pubchemBaseUrl;
    }

    public boolean isPubchemEnabled() {
        return pubchemEnabled;
    }

    public boolean isWikidataEnabled() {
        return wikidataEnabled;
    }

    public String getWikidataSparqlUrl() {
        return wikidataSparqlUrl;
    }

    public String getWikidataEntityUrl() {
        return wikidataEntityUrl;
    }

    public Duration getWikidataTimeout() {
        return wikidataTimeout;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public QualityTier getTargetTier() {
        return targetTier;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public boolean isRetryFailed() {
        return retryFailed;
    }

    @Override
    public String toString() {
        return "EnrichmentSettings{workSet=" + workSetPath + " (" + workSetFormat + ")" +
                ", output=" + outputPath +
                ", export=" + exportPath +
                ", maxItems=" + maxItems +
                ", targetTier=" + targetTier +
                ", pubchem=" + pubchemEnabled +
                ", wikidata=" + wikidataEnabled +
                ", retryFailed=" + retryFailed +
                ", cache=" + cacheConfig.enabled() + '}';
    }
}
