package com.compound.enrichment.config;

import com.compound.enrichment.core.model.QualityTier;
import com.compound.enrichment.lookup.PubChemLookupSource;
import com.compound.enrichment.source.WikidataEntrySource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnrichmentSettingsTest {

    private static Config config(Map<String, String> values) {
        return new SmallRyeConfigBuilder().withDefaultValues(values).build();
    }

    private static Map<String, String> minimal() {
        Map<String, String> values = new HashMap<>();
        values.put("enrichment.work-set.path", "data/plants.csv");
        values.put("enrichment.output.path", "out/results.txt");
        return values;
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should fill in defaults around the two required paths")
        void testDefaults() {
            EnrichmentSettings settings = EnrichmentSettings.from(config(minimal()));

            assertEquals(Path.of("data/plants.csv"), settings.getWorkSetPath());
            assertEquals(EnrichmentSettings.WorkSetFormat.CSV, settings.getWorkSetFormat());
            assertEquals(Path.of("out/results.csv"), settings.getExportPath());
            assertEquals(" or ", settings.getSynonymSeparator());
            assertEquals(0, settings.getMaxItems());
            assertEquals(QualityTier.FULL, settings.getTargetTier());
            assertEquals(Duration.ofSeconds(10), settings.getHttpTimeout());
            assertEquals(PubChemLookupSource.DEFAULT_BASE_URL, settings.getPubchemBaseUrl());
            assertFalse(settings.isWikidataEnabled());
            assertTrue(settings.isPubchemEnabled());
            assertFalse(settings.isRetryFailed());
            assertTrue(settings.getCacheConfig().enabled());
            assertTrue(settings.isMetricsEnabled());
        }

        @Test
        @DisplayName("Should space API calls per endpoint")
        void testRateLimits() {
            EnrichmentSettings settings = EnrichmentSettings.from(config(minimal()));

            assertEquals(Duration.ofMillis(200), settings.getRateLimitConfig().intervalFor(PubChemLookupSource.RATE_LIMIT_KEY));
            assertEquals(Duration.ofMillis(300), settings.getRateLimitConfig().intervalFor(WikidataEntrySource.RATE_LIMIT_KEY));
            assertEquals(Duration.ofMillis(200), settings.getRateLimitConfig().intervalFor("anything-else"));
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("Should honour explicit values")
        void testOverrides() {
            Map<String, String> values = minimal();
            values.put("enrichment.work-set.path", "compounds.JSON");
            values.put("enrichment.work-set.synonym-word", "aka");
            values.put("enrichment.export.path", "tables/export.csv");
            values.put("enrichment.rate-limit.pubchem-ms", "50");
            values.put("enrichment.resolution.target-tier", "degraded");
            values.put("enrichment.cache.enabled", "false");
            values.put("enrichment.wikidata.enabled", "true");
            values.put("enrichment.pubchem.enabled", "false");
            values.put("enrichment.resume.retry-failed", "true");

            EnrichmentSettings settings = EnrichmentSettings.from(config(values));

            assertEquals(EnrichmentSettings.WorkSetFormat.JSON, settings.getWorkSetFormat());
            assertEquals(" aka ", settings.getSynonymSeparator());
            assertEquals(Path.of("tables/export.csv"), settings.getExportPath());
            assertEquals(Duration.ofMillis(50), settings.getRateLimitConfig().intervalFor(PubChemLookupSource.RATE_LIMIT_KEY));
            assertEquals(QualityTier.DEGRADED, settings.getTargetTier());
            assertFalse(settings.getCacheConfig().enabled());
            assertTrue(settings.isWikidataEnabled());
            assertFalse(settings.isPubchemEnabled());
            assertTrue(settings.isRetryFailed());
        }

        @Test
        @DisplayName("Should let an explicit format win over the file extension")
        void testExplicitFormat() {
            Map<String, String> values = minimal();
            values.put("enrichment.work-set.format", "json");

            assertEquals(EnrichmentSettings.WorkSetFormat.JSON,
                    EnrichmentSettings.from(config(values)).getWorkSetFormat());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {"enrichment.work-set.path", "enrichment.output.path"})
        @DisplayName("Should fail when a required path is missing")
        void testMissingRequired(String key) {
            Map<String, String> values = minimal();
            values.remove(key);

            FatalConfigurationException e = assertThrows(FatalConfigurationException.class,
                    () -> EnrichmentSettings.from(config(values)));
            assertTrue(e.getMessage().contains(key));
        }

        @Test
        @DisplayName("Should reject UNRESOLVED as a target tier")
        void testUnresolvedTarget() {
            Map<String, String> values = minimal();
            values.put("enrichment.resolution.target-tier", "UNRESOLVED");

            assertThrows(FatalConfigurationException.class, () -> EnrichmentSettings.from(config(values)));
        }

        @Test
        @DisplayName("Should reject a run with both PubChem and Wikidata switched off")
        void testNothingEnabled() {
            Map<String, String> values = minimal();
            values.put("enrichment.pubchem.enabled", "false");
            values.put("enrichment.wikidata.enabled", "false");

            assertThrows(FatalConfigurationException.class, () -> EnrichmentSettings.from(config(values)));
        }

        @Test
        @DisplayName("Should reject unknown formats and negative intervals")
        void testInvalidValues() {
            Map<String, String> format = minimal();
            format.put("enrichment.work-set.format", "xml");
            Map<String, String> interval = minimal();
            interval.put("enrichment.rate-limit.default-ms", "-1");

            assertThrows(FatalConfigurationException.class, () -> EnrichmentSettings.from(config(format)));
            assertThrows(FatalConfigurationException.class, () -> EnrichmentSettings.from(config(interval)));
        }
    }

    @Test
    @DisplayName("Should derive sibling paths with a new extension")
    void testSiblingWithExtension() {
        assertEquals(Path.of("out/results.csv"), EnrichmentSettings.siblingWithExtension(Path.of("out/results.txt"), ".csv"));
        assertEquals(Path.of("results.csv"), EnrichmentSettings.siblingWithExtension(Path.of("results"), ".csv"));
    }
}
