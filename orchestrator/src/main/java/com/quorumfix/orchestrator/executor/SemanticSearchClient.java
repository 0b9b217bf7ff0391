package com.quorumfix.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quorumfix.orchestrator.executor.dto.SearchRequest;
import com.quorumfix.orchestrator.executor.dto.SearchResponse;
import com.quorumfix.orchestrator.workspace.ContextSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Client for the semantic code search service.
 *
 * Only created when {@code quorumfix.context-search.base-url} is set; without
 * it the repair loop loads context from the failing tests alone.
 */
@Component
@ConditionalOnProperty(prefix = "quorumfix.context-search", name = "base-url")
public class SemanticSearchClient implements ContextSearch {

    private static final Logger log = LoggerFactory.getLogger(SemanticSearchClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       collection;

    public SemanticSearchClient(
            @Value("${quorumfix.context-search.base-url}") String baseUrl,
            @Value("${quorumfix.context-search.collection:${quorumfix.executor.workspace-ref:default}}") String collection,
            ObjectMapper objectMapper) {
        this.baseUrl    = baseUrl;
        this.collection = collection;
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * @throws ExecutorException if the search service fails; the caller falls back
     */
    @Override
    public List<SearchHit> search(String query, int limit, double scoreThreshold) {
        try {
            String body = json.writeValueAsString(new SearchRequest(query, collection, limit, scoreThreshold));
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/search"))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException("search failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            SearchResponse parsed = json.readValue(resp.body(), SearchResponse.class);
            List<SearchHit> hits = parsed.results() == null ? List.of()
                    : parsed.results().stream()
                            .filter(r -> r.file() != null && !r.file().isBlank())
                            .map(r -> new SearchHit(r.file(), r.content(), r.score()))
                            .toList();
            log.debug("Search '{}' returned {} hit(s)", abbreviate(query), hits.size());
            return hits;
        } catch (ExecutorException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse search response", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException("search interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException("search failed", e);
        }
    }

    private static String abbreviate(String query) {
        return query.length() <= 100 ? query : query.substring(0, 100) + "...";
    }
}
