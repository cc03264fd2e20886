package com.pagesentry.analyze.model;

import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Cleaned visible text plus the parsed document it came from.
 */
public record ExtractedPage(
    String url,
    String text,
    Document document,
    List<String> imageUrls,
    int frameworkMarkers
) {
    public int textLength() {
        return text == null ? 0 : text.length();
    }
}
