package com.compound.enrichment.source;

import com.compound.enrichment.core.model.RawEntry;
import com.compound.enrichment.core.model.WorkItem;
import com.compound.enrichment.lookup.SourceUnavailableException;
import com.compound.enrichment.ratelimit.RateLimiter;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reports the compounds found in a taxon according to the LOTUS natural products
 * dataset on Wikidata.
 *
 * <p>Every query name of the item (its label split into synonyms) is looked up as a
 * taxon name (P225); compounds are those with a "found in taxon" (P703) statement,
 * together with SMILES (P233), InChIKey (P235) and the reference backing the
 * statement. References are decorated through {@link ReferenceMetadataClient}.</p>
 */
public class WikidataEntrySource implements EntrySource {
    private static final Logger log = LoggerFactory.getLogger(WikidataEntrySource.class);

    public static final String DEFAULT_SPARQL_URL = "https://query.wikidata.org/sparql";
    public static final String RATE_LIMIT_KEY = "wikidata-sparql";

    private static final String QUERY_TEMPLATE = """
            SELECT ?compound ?compoundLabel ?smiles ?inchikey ?reference WHERE {
              ?taxon wdt:P225 "%s" .
              ?compound p:P703 ?statement .
              ?statement ps:P703 ?taxon .
              OPTIONAL { ?statement prov:wasDerivedFrom ?refnode .
                         ?refnode pr:P248 ?reference . }
              OPTIONAL { ?compound wdt:P233 ?smiles . }
              OPTIONAL { ?compound wdt:P235 ?inchikey . }
              SERVICE wikibase:label { bd:serviceParam wikibase:language "en" . }
            }
            ORDER BY ?compoundLabel
            """;

    private final String sparqlUrl;
    private final Duration timeout;
    private final String userAgent;
    private final RateLimiter rateLimiter;
    private final ReferenceMetadataClient referenceClient;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private WikidataEntrySource(Builder builder) {
        this.sparqlUrl = builder.sparqlUrl != null ? builder.sparqlUrl : DEFAULT_SPARQL_URL;
        this.timeout = builder.timeout != null ? builder.timeout : Duration.ofSeconds(60);
        this.userAgent = builder.userAgent;
        this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter is required");
        this.referenceClient = Objects.requireNonNull(builder.referenceClient, "referenceClient is required");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<RawEntry> fetch(WorkItem item) {
        List<RawEntry> entries = new ArrayList<>();
        for (String name : item.getQueryNames()) {
            entries.addAll(queryTaxon(name));
        }
        log.debug("lotus.fetched item={} names={} rows={}", item.getKey(), item.getQueryNames().size(), entries.size());
        return entries;
    }

    @Override
    public String getSourceName() {
        return "Wikidata/LOTUS";
    }

    private List<RawEntry> queryTaxon(String taxonName) {
        String query = buildQuery(taxonName);
        rateLimiter.acquire(RATE_LIMIT_KEY);

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(sparqlUrl + "?format=json&query=" + URLEncoder.encode(query, StandardCharsets.UTF_8)))
                .timeout(timeout)
                .header("Accept", "application/sparql-results+json")
                .GET();
        if (userAgent != null && !userAgent.isBlank()) {
            request.header("User-Agent", userAgent);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException("SPARQL query for '" + taxonName + "' failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("SPARQL query for '" + taxonName + "' interrupted", e);
        }
        if (response.statusCode() != 200) {
            throw SourceUnavailableException.forStatus("wikidata-sparql", response.statusCode(), response.body());
        }

        JsonNode bindings;
        try {
            bindings = objectMapper.readTree(response.body()).path("results").path("bindings");
        } catch (IOException e) {
            throw new SourceUnavailableException("SPARQL response for '" + taxonName + "' is malformed", e);
        }

        List<RawEntry> rows = new ArrayList<>();
        for (JsonNode binding : bindings) {
            String reference = value(binding, "reference");
            ReferenceMetadata metadata = reference.isEmpty()
                    ? ReferenceMetadata.empty()
                    : referenceClient.fetch(reference);
            rows.add(new RawEntry(
                    value(binding, "compoundLabel"),
                    value(binding, "smiles"),
                    value(binding, "inchikey"),
                    reference,
                    metadata.title(),
                    metadata.doi(),
                    metadata.publishedOn()));
        }
        return rows;
    }

    static String buildQuery(String taxonName) {
        String escaped = taxonName.replace("\\", "\\\\").replace("\"", "\\\"");
        return QUERY_TEMPLATE.formatted(escaped);
    }

    private static String value(JsonNode binding, String variable) {
        return binding.path(variable).path("value").asText("");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sparqlUrl;
        private Duration timeout;
        private String userAgent;
        private RateLimiter rateLimiter;
        private ReferenceMetadataClient referenceClient;

        public Builder sparqlUrl(String sparqlUrl) {
            this.sparqlUrl = sparqlUrl;
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

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder referenceClient(ReferenceMetadataClient referenceClient) {
            this.referenceClient = referenceClient;
            return this;
        }

        public WikidataEntrySource build() {
            return new WikidataEntrySource(this);
        }
    }
}
