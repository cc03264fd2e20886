package com.pagesentry.analyze.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Historical field-name variants used by the fetcher and the render service.
 */
public final class PayloadAliases {
    public static final List<String> HTML_FIELDS = List.of("html", "HTML", "html_content", "htmlContent", "content", "body");
    public static final List<String> URL_FIELDS = List.of("url", "URL", "final_url", "finalUrl");
    public static final List<String> TASK_ID_FIELDS = List.of("task_id", "taskId", "request_id", "requestId", "id");
    public static final List<String> MAIN_URL_FIELDS = List.of("main_url", "mainUrl", "MainURL", "url");
    public static final List<String> PAGES_FIELDS = List.of("pages", "Pages");

    private PayloadAliases() {
    }

    /**
     * First non-blank textual value among {@code fields}, or null.
     */
    public static String firstText(JsonNode node, List<String> fields) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText();
                if (text != null && !text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    public static JsonNode firstArray(JsonNode node, List<String> fields) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isArray()) {
                return value;
            }
        }
        return null;
    }
}
