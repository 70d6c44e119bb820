package com.compound.enrichment.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks up isomeric SMILES through the PubChem PUG REST API.
 *
 * <p>One instance queries by a single namespace, either InChIKey or compound name:</p>
 * <pre>
 * GET {baseUrl}/compound/inchikey/{key}/property/IsomericSMILES/JSON
 * GET {baseUrl}/compound/name/{name}/property/IsomericSMILES/JSON
 * </pre>
 *
 * <p>HTTP 404 means the compound is unknown and is reported as an empty result. Any
 * other failure raises {@link SourceUnavailableException}.</p>
 *
 * Usage:
 * <pre>
 * PubChemLookupSource byKey = PubChemLookupSource.builder()
 *     .queryBy(PubChemLookupSource.Namespace.INCHIKEY)
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 * </pre>
 */
public class PubChemLookupSource implements LookupSource {
    private static final Logger log = LoggerFactory.getLogger(PubChemLookupSource.class);

    public static final String DEFAULT_BASE_URL = "https://pubchem.ncbi.nlm.nih.gov/rest/pug";
    public static final String RATE_LIMIT_KEY = "pubchem";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * PubChem input namespace.
     */
    public enum Namespace {
        INCHIKEY("inchikey"),
        NAME("name");

        private final String path;

        Namespace(String path) {
            this.path = path;
        }

        public String path() {
            return path;
        }
    }

    private final String baseUrl;
    private final Namespace namespace;
    private final Duration timeout;
    private final String userAgent;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private PubChemLookupSource(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.namespace = Objects.requireNonNull(builder.namespace, "namespace is required");
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.userAgent = builder.userAgent;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<String> lookup(String key) {
        URI uri = URI.create(baseUrl + "/compound/" + namespace.path() + "/"
                + encodePathSegment(key) + "/property/IsomericSMILES/JSON");
        log.debug("pubchem.lookup namespace={} key='{}'", namespace, key);

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (userAgent != null && !userAgent.isBlank()) {
            request.header("User-Agent", userAgent);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException(getSourceId() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(getSourceId() + " request interrupted", e);
        }

        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() != 200) {
            throw SourceUnavailableException.forStatus(getSourceId(), response.statusCode(), response.body());
        }
        return parseSmiles(response.body());
    }

    /**
     * Extracts the SMILES of the first property row. PubChem has reported it under both
     * {@code IsomericSMILES} and {@code SMILES}.
     */
    Optional<String> parseSmiles(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SourceUnavailableException(getSourceId() + " returned malformed JSON", e);
        }
        JsonNode properties = root.path("PropertyTable").path("Properties");
        if (!properties.isArray()) {
            throw new SourceUnavailableException(getSourceId() + " response has no PropertyTable");
        }
        if (properties.isEmpty()) {
            return Optional.empty();
        }
        JsonNode first = properties.get(0);
        for (String field : new String[]{"IsomericSMILES", "SMILES"}) {
            String smiles = first.path(field).asText("");
            if (!smiles.isBlank()) {
                return Optional.of(smiles);
            }
        }
        return Optional.empty();
    }

    @Override
    public String getSourceId() {
        return "pubchem-" + namespace.path();
    }

    @Override
    public String getRateLimitKey() {
        return RATE_LIMIT_KEY;
    }

    public Namespace getNamespace() {
        return namespace;
    }

    private static String encodePathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Namespace namespace;
        private Duration timeout;
        private String userAgent;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder queryBy(Namespace namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public PubChemLookupSource build() {
            return new PubChemLookupSource(this);
        }
    }
}
