package com.compound.enrichment.lookup;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.*;

class PubChemLookupSourceTest {

    private static final String INCHIKEY = "BQJCRHHNABKAKU-KBQPJGBKSA-N";

    private WireMockServer server;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private PubChemLookupSource source(PubChemLookupSource.Namespace namespace) {
        return PubChemLookupSource.builder()
                .baseUrl(server.baseUrl() + "/rest/pug")
                .queryBy(namespace)
                .timeout(Duration.ofSeconds(5))
                .userAgent("enrichment-test")
                .build();
    }

    private static String propertyTable(String field, String smiles) {
        return "{\"PropertyTable\":{\"Properties\":[{\"CID\":5288826,\"" + field + "\":\"" + smiles + "\"}]}}";
    }

    @Nested
    @DisplayName("Successful lookups")
    class Found {

        @Test
        @DisplayName("Should read IsomericSMILES for an InChIKey")
        void testInchiKeyLookup() {
            server.stubFor(get(urlEqualTo("/rest/pug/compound/inchikey/" + INCHIKEY + "/property/IsomericSMILES/JSON"))
                    .willReturn(aResponse().withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody(propertyTable("IsomericSMILES", "CN1CC[C@]23"))));

            Optional<String> smiles = source(PubChemLookupSource.Namespace.INCHIKEY).lookup(INCHIKEY);

            assertEquals(Optional.of("CN1CC[C@]23"), smiles);
            server.verify(getRequestedFor(urlEqualTo("/rest/pug/compound/inchikey/" + INCHIKEY
                    + "/property/IsomericSMILES/JSON"))
                    .withHeader("User-Agent", equalTo("enrichment-test")));
        }

        @Test
        @DisplayName("Should accept the SMILES property and encode names with spaces")
        void testNameLookup() {
            server.stubFor(get(urlEqualTo("/rest/pug/compound/name/chlorogenic%20acid/property/IsomericSMILES/JSON"))
                    .willReturn(aResponse().withStatus(200)
                            .withBody(propertyTable("SMILES", "O=C(O)C1"))));

            Optional<String> smiles = source(PubChemLookupSource.Namespace.NAME).lookup("chlorogenic acid");

            assertEquals(Optional.of("O=C(O)C1"), smiles);
        }
    }

    @Nested
    @DisplayName("Misses and failures")
    class Failures {

        @Test
        @DisplayName("Should report 404 as not found")
        void testNotFound() {
            server.stubFor(get(urlEqualTo("/rest/pug/compound/name/unobtainium/property/IsomericSMILES/JSON"))
                    .willReturn(aResponse().withStatus(404).withBody("{\"Fault\":{}}")));

            assertTrue(source(PubChemLookupSource.Namespace.NAME).lookup("unobtainium").isEmpty());
        }

        @Test
        @DisplayName("Should raise a retryable SourceUnavailableException on 503")
        void testServerError() {
            server.stubFor(get(urlEqualTo("/rest/pug/compound/name/quinine/property/IsomericSMILES/JSON"))
                    .willReturn(aResponse().withStatus(503).withBody("busy")));

            SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                    () -> source(PubChemLookupSource.Namespace.NAME).lookup("quinine"));

            assertEquals(503, e.getStatusCode());
            assertTrue(e.isRetryable());
        }

        @Test
        @DisplayName("Should raise a non-retryable SourceUnavailableException on 400")
        void testBadRequest() {
            server.stubFor(get(urlEqualTo("/rest/pug/compound/name/quinine/property/IsomericSMILES/JSON"))
                    .willReturn(aResponse().withStatus(400).withBody("bad")));

            SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                    () -> source(PubChemLookupSource.Namespace.NAME).lookup("quinine"));

            assertFalse(e.isRetryable());
        }

        @Test
        @DisplayName("Should raise SourceUnavailableException on malformed JSON")
        void testMalformedBody() {
            server.stubFor(get(urlEqualTo("/rest/pug/compound/name/quinine/property/IsomericSMILES/JSON"))
                    .willReturn(aResponse().withStatus(200).withBody("<html>")));

            assertThrows(SourceUnavailableException.class,
                    () -> source(PubChemLookupSource.Namespace.NAME).lookup("quinine"));
        }

        @Test
        @DisplayName("Should treat an empty property table as not found")
        void testEmptyProperties() {
            server.stubFor(get(urlEqualTo("/rest/pug/compound/name/quinine/property/IsomericSMILES/JSON"))
                    .willReturn(aResponse().withStatus(200).withBody("{\"PropertyTable\":{\"Properties\":[]}}")));

            assertTrue(source(PubChemLookupSource.Namespace.NAME).lookup("quinine").isEmpty());
        }
    }

    @Test
    @DisplayName("Should share one rate-limit key across query modes")
    void testIdentity() {
        PubChemLookupSource byKey = source(PubChemLookupSource.Namespace.INCHIKEY);
        PubChemLookupSource byName = source(PubChemLookupSource.Namespace.NAME);

        assertEquals("pubchem-inchikey", byKey.getSourceId());
        assertEquals("pubchem-name", byName.getSourceId());
        assertEquals(PubChemLookupSource.RATE_LIMIT_KEY, byKey.getRateLimitKey());
        assertEquals(byKey.getRateLimitKey(), byName.getRateLimitKey());
    }
}
