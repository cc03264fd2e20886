package com.pagesentry.analyze.http;

import com.pagesentry.analyze.model.FetchResult;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.config.AnalyzerProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;

/**
 * Size-bounded GET for page images. Bodies are cut at {@code extraction.maxImageBytes}.
 */
@Component
public class ImageFetcher {
    private final HttpClient client;
    private final AnalyzerProperties properties;

    public ImageFetcher(HttpClient client, AnalyzerProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public FetchResult fetch(String url) {
        Instant startedAt = Instant.now();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException | NullPointerException e) {
            return error(url, startedAt, FailureReasons.INVALID_URL, e.getMessage());
        }
        if (uri.getHost() == null) {
            return error(url, startedAt, FailureReasons.INVALID_URL, "URL missing host");
        }
        int maxBytes = properties.getExtraction().getMaxImageBytes();
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getExtraction().getImageTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "image/*")
            .GET()
            .build();
        try {
            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            byte[] body;
            boolean truncated;
            try (InputStream in = response.body()) {
                body = in.readNBytes(maxBytes);
                truncated = body.length >= maxBytes && in.read() != -1;
            }
            String errorCode = null;
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                errorCode = FailureReasons.fromHttpStatus(response.statusCode());
            }
            return new FetchResult(
                url,
                response.uri(),
                response.statusCode(),
                body,
                response.headers().firstValue("Content-Type").orElse(null),
                truncated,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                errorCode,
                errorCode == null ? null : "HTTP " + response.statusCode()
            );
        } catch (HttpTimeoutException e) {
            return error(url, startedAt, FailureReasons.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return error(url, startedAt, FailureReasons.IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return error(url, startedAt, FailureReasons.INTERRUPTED, e.getMessage());
        }
    }

    private static FetchResult error(String url, Instant startedAt, String code, String message) {
        return new FetchResult(
            url, null, 0, null, null, false, Instant.now(), Duration.between(startedAt, Instant.now()), code, message
        );
    }
}
