package com.pagesentry.analyze.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagesentry.analyze.model.ScreenshotCapture;
import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.analyze.util.PayloadAliases;
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
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Client for the headless render service. Never throws: every failure comes back as a
 * {@link StageResult} with a {@link FailureReasons} code.
 */
@Component
public class RenderServiceClient {
    private static final Logger log = LoggerFactory.getLogger(RenderServiceClient.class);
    private static final String DEFAULT_IMAGE_TYPE = "image/png";

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final AnalyzerProperties properties;

    public RenderServiceClient(HttpClient client, ObjectMapper objectMapper, AnalyzerProperties properties) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public boolean isEnabled() {
        return properties.getRender().isEnabled();
    }

    /**
     * Fully executed HTML for {@code url}.
     */
    public StageResult<String> render(String url) {
        if (!isEnabled()) {
            return StageResult.failed(FailureReasons.DISABLED, "render service disabled");
        }
        ObjectNode body = objectMapper.createObjectNode().put("url", url);
        StageResult<JsonNode> response = post("/render", body, properties.getRender().getTimeoutSeconds());
        if (!response.isOk()) {
            return StageResult.failed(response.errorCode(), response.errorMessage());
        }
        JsonNode data = response.value();
        if (data.has("ok") && !data.get("ok").asBoolean(false)) {
            return StageResult.failed(FailureReasons.EMPTY_RESPONSE, data.path("error").asText("render not ok"));
        }
        String html = PayloadAliases.firstText(data, PayloadAliases.HTML_FIELDS);
        if (html == null) {
            return StageResult.failed(FailureReasons.EMPTY_RESPONSE, "no html in render response");
        }
        if (!looksLikeHtml(html)) {
            return StageResult.failed(FailureReasons.NOT_HTML, "render response is not html");
        }
        return StageResult.ok(html);
    }

    /**
     * Screenshot crop around {@code keyword} on the rendered page.
     */
    public StageResult<ScreenshotCapture> renderAndScreenshot(String url, String keyword, int maxMatches) {
        if (!isEnabled()) {
            return StageResult.failed(FailureReasons.DISABLED, "render service disabled");
        }
        ObjectNode body = objectMapper.createObjectNode()
            .put("url", url)
            .put("keyword", keyword)
            .put("max_matches", Math.max(1, maxMatches))
            .put("upload", false);
        StageResult<JsonNode> response = post(
            "/render-and-screenshot", body, properties.getRender().getScreenshotTimeoutSeconds()
        );
        if (!response.isOk()) {
            return StageResult.failed(response.errorCode(), response.errorMessage());
        }
        JsonNode data = response.value();
        if (data.has("ok") && !data.get("ok").asBoolean(false)) {
            return StageResult.failed(FailureReasons.EMPTY_RESPONSE, data.path("error").asText("screenshot not ok"));
        }
        String encoded = screenshotField(data);
        if (encoded == null) {
            return StageResult.failed(FailureReasons.EMPTY_RESPONSE, "no screenshot in response");
        }
        byte[] image;
        try {
            image = Base64.getDecoder().decode(stripDataUrl(encoded));
        } catch (IllegalArgumentException e) {
            return StageResult.failed(FailureReasons.PARSE_ERROR, "screenshot is not base64");
        }
        return StageResult.ok(new ScreenshotCapture(image, DEFAULT_IMAGE_TYPE, matchCount(data)));
    }

    private StageResult<JsonNode> post(String path, JsonNode body, int timeoutSeconds) {
        String endpoint = UrlUtils.trimTrailingSlash(properties.getRender().getBaseUrl()) + path;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8))
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return StageResult.failed(FailureReasons.fromHttpStatus(response.statusCode()), "HTTP " + response.statusCode());
            }
            String responseBody = response.body();
            if (responseBody == null || responseBody.isBlank()) {
                return StageResult.failed(FailureReasons.EMPTY_RESPONSE, "empty body");
            }
            return StageResult.ok(objectMapper.readTree(responseBody));
        } catch (HttpTimeoutException e) {
            log.warn("Render call {} timed out after {}s", endpoint, timeoutSeconds);
            return StageResult.failed(FailureReasons.TIMEOUT, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StageResult.failed(FailureReasons.INTERRUPTED, e.getMessage());
        } catch (JsonProcessingException e) {
            return StageResult.failed(FailureReasons.PARSE_ERROR, e.getOriginalMessage());
        } catch (IOException e) {
            return StageResult.failed(FailureReasons.IO_ERROR, e.getMessage());
        } catch (IllegalArgumentException e) {
            return StageResult.failed(FailureReasons.INVALID_URL, e.getMessage());
        }
    }

    private static String screenshotField(JsonNode data) {
        String direct = PayloadAliases.firstText(data, List.of("screenshot_b64", "screenshot"));
        if (direct != null) {
            return direct;
        }
        JsonNode matches = data.get("matches");
        if (matches != null && matches.isArray()) {
            for (JsonNode match : matches) {
                String nested = PayloadAliases.firstText(match, List.of("screenshot_b64", "screenshot"));
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private static int matchCount(JsonNode data) {
        JsonNode matches = data.get("matches");
        if (matches == null) {
            return 0;
        }
        return matches.isArray() ? matches.size() : matches.asInt(0);
    }

    private static String stripDataUrl(String encoded) {
        int comma = encoded.indexOf(',');
        return encoded.startsWith("data:") && comma > 0 ? encoded.substring(comma + 1) : encoded.trim();
    }

    private static boolean looksLikeHtml(String html) {
        String head = html.substring(0, Math.min(html.length(), 1024)).toLowerCase(Locale.ROOT);
        return head.contains("<html") || head.contains("<!doctype") || head.contains("<body") || head.contains("<div");
    }
}
