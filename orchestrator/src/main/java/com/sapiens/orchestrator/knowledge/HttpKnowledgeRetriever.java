package com.sapiens.orchestrator.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the knowledge-retrieval service.
 *
 * <pre>
 *   POST {base-url}/search  {query, domain_filter?, top_k}
 *     → {results: [{content, source, score}]}
 * </pre>
 *
 * Any failure (connect error, non-2xx, unparseable body) is logged and
 * degrades to an empty result.
 */
public class HttpKnowledgeRetriever implements KnowledgeRetriever {

    private static final Logger log = LoggerFactory.getLogger(HttpKnowledgeRetriever.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<Snippet> results) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public HttpKnowledgeRetriever(String baseUrl, Duration timeout, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public List<Snippet> search(String query, String domainFilter, int topK) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        try {
            Map<String, Object> body = new HashMap<>();
            body.put("query", query);
            body.put("top_k", topK);
            if (domainFilter != null && !domainFilter.isBlank()) {
                body.put("domain_filter", domainFilter);
            }

            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/search"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                log.warn("Knowledge search returned HTTP {}; continuing without context", resp.statusCode());
                return List.of();
            }

            SearchResponse parsed = json.readValue(resp.body(), SearchResponse.class);
            if (parsed.results() == null) {
                return List.of();
            }
            return parsed.results().stream()
                    .sorted(Comparator.comparingDouble(Snippet::score).reversed())
                    .limit(topK)
                    .toList();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Knowledge search interrupted; continuing without context");
            return List.of();
        } catch (Exception e) {
            log.warn("Knowledge search failed; continuing without context: {}", e.getMessage());
            return List.of();
        }
    }
}
