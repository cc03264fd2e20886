package com.pagesentry.analyze.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagesentry.analyze.model.IngestSummary;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.analyze.util.UrlUtils;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort summary indexing into an OpenSearch-compatible index. Failures are logged and swallowed.
 */
@Component
public class SearchIndexClient {
    private static final Logger log = LoggerFactory.getLogger(SearchIndexClient.class);

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final AnalyzerProperties properties;

    public SearchIndexClient(HttpClient client, ObjectMapper objectMapper, AnalyzerProperties properties) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public boolean indexSummary(IngestSummary summary, List<String> keywords) {
        AnalyzerProperties.Search search = properties.getSearch();
        if (!search.isEnabled() || summary == null) {
            return false;
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("task_id", summary.taskId());
        document.put("main_url", summary.mainUrl());
        document.put("total_pages", summary.totalPages());
        document.put("total_matches", summary.totalMatches());
        document.put("categories", summary.categories());
        document.put("keywords", keywords == null ? List.of() : keywords);
        document.put("status", summary.status());
        document.put("indexed_at", Instant.now().toString());
        String endpoint = UrlUtils.trimTrailingSlash(search.getBaseUrl()) + "/" + search.getIndex() + "/_doc";
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint))
                .timeout(Duration.ofSeconds(search.getTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(document), StandardCharsets.UTF_8))
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                return true;
            }
            log.warn("Search index rejected summary task={} status={} reason={}",
                summary.taskId(), response.statusCode(), FailureReasons.fromHttpStatus(response.statusCode()));
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted indexing summary task={}", summary.taskId());
            return false;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to index summary task={} reason={}", summary.taskId(), FailureReasons.fromException(e), e);
            return false;
        }
    }
}
