package com.compound.enrichment.source;

import com.compound.enrichment.cache.CacheConfig;
import com.compound.enrichment.ratelimit.RateLimiter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Fetches DOI (P356), title (P1476) and publication date (P577) of a Wikidata item
 * from its entity JSON document.
 *
 * <p>Metadata is optional decoration: any failure yields {@link ReferenceMetadata#empty()}.
 * Successful fetches are cached by QID since the same reference backs many compounds.</p>
 */
public class ReferenceMetadataClient {
    private static final Logger log = LoggerFactory.getLogger(ReferenceMetadataClient.class);

    public static final String DEFAULT_ENTITY_URL = "https://www.wikidata.org/wiki/Special:EntityData";
    public static final String RATE_LIMIT_KEY = "wikidata-entity";
    private static final Pattern QID_PATTERN = Pattern.compile("Q[0-9]+");

    private final String entityUrl;
    private final Duration timeout;
    private final String userAgent;
    private final RateLimiter rateLimiter;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Cache<String, ReferenceMetadata> cache;

    public ReferenceMetadataClient(String entityUrl, Duration timeout, String userAgent,
                                   RateLimiter rateLimiter, CacheConfig cacheConfig) {
        String url = entityUrl != null ? entityUrl : DEFAULT_ENTITY_URL;
        this.entityUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.userAgent = userAgent;
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter is required");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = new ObjectMapper();
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheConfig.enabled() ? cacheConfig.maxSize() : 0)
                .expireAfterWrite(Duration.ofSeconds(cacheConfig.ttlSeconds()))
                .build();
    }

    /**
     * Returns the metadata of a reference, given its QID or its entity URI.
     */
    public ReferenceMetadata fetch(String reference) {
        String qid = extractQid(reference);
        if (qid == null) {
            return ReferenceMetadata.empty();
        }
        ReferenceMetadata cached = cache.getIfPresent(qid);
        if (cached != null) {
            return cached;
        }
        ReferenceMetadata metadata = download(qid);
        if (!metadata.isEmpty()) {
            cache.put(qid, metadata);
        }
        return metadata;
    }

    /**
     * Extracts {@code Q123} from {@code http://www.wikidata.org/entity/Q123} or a bare QID.
     */
    static String extractQid(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        String last = reference.substring(reference.lastIndexOf('/') + 1).trim();
        return QID_PATTERN.matcher(last).matches() ? last : null;
    }

    private ReferenceMetadata download(String qid) {
        rateLimiter.acquire(RATE_LIMIT_KEY);
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(entityUrl + "/" + qid + ".json"))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (userAgent != null && !userAgent.isBlank()) {
            request.header("User-Agent", userAgent);
        }
        try {
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("reference.metadata.status qid={} status={}", qid, response.statusCode());
                return ReferenceMetadata.empty();
            }
            return parse(qid, objectMapper.readTree(response.body()));
        } catch (IOException e) {
            log.debug("reference.metadata.failed qid={} error={}", qid, e.getMessage());
            return ReferenceMetadata.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ReferenceMetadata.empty();
        }
    }

    static ReferenceMetadata parse(String qid, JsonNode root) {
        JsonNode claims = root.path("entities").path(qid).path("claims");
        String doi = firstValue(claims, "P356").asText("");

        JsonNode titleValue = firstValue(claims, "P1476");
        String title = titleValue.isObject() ? titleValue.path("text").asText("") : titleValue.asText("");

        String date = ReferenceMetadata.cleanWikidataDate(firstValue(claims, "P577").path("time").asText(""));
        return new ReferenceMetadata(doi, title, date);
    }

    private static JsonNode firstValue(JsonNode claims, String property) {
        return claims.path(property).path(0).path("mainsnak").path("datavalue").path("value");
    }
}
