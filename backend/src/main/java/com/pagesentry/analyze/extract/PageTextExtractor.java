package com.pagesentry.analyze.extract;

import com.pagesentry.analyze.model.ExtractedPage;
import com.pagesentry.analyze.util.TextCleaner;
import com.pagesentry.analyze.util.UrlUtils;
import com.pagesentry.config.AnalyzerProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Visible text and image references from raw HTML.
 */
@Component
public class PageTextExtractor {
    static final List<String> FRAMEWORK_MARKERS = List.of(
        "__next_data__", "id=\"__next\"", "data-reactroot", "ng-version",
        "vite", "webpackjsonp", "window.__apollo_state__", "nuxt",
        "id=\"root\"", "id=\"app\"", "astro-island", "svelte"
    );
    private static final String HIDDEN_SELECTOR = "script, style, nav, footer, noscript, template";

    private final int maxImages;

    public PageTextExtractor(AnalyzerProperties properties) {
        this.maxImages = properties.getExtraction().getMaxImages();
    }

    public ExtractedPage extract(String url, String html) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        List<String> images = imageUrls(url, document);
        Document visible = document.clone();
        visible.select(HIDDEN_SELECTOR).remove();
        Element root = visible.body() != null ? visible.body() : visible;
        String text = TextCleaner.clean(root.text());
        return new ExtractedPage(url, text, document, images, frameworkMarkers(html));
    }

    static int frameworkMarkers(String html) {
        if (html == null || html.isEmpty()) {
            return 0;
        }
        String lower = html.toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String marker : FRAMEWORK_MARKERS) {
            if (lower.contains(marker)) {
                hits++;
            }
        }
        return hits;
    }

    private List<String> imageUrls(String pageUrl, Document document) {
        Set<String> out = new LinkedHashSet<>();
        for (Element img : document.select("img")) {
            if (out.size() >= maxImages) {
                break;
            }
            String src = img.attr("src");
            if (src.isBlank()) {
                src = img.attr("data-src");
            }
            if (src.startsWith("//")) {
                src = "https:" + src;
            }
            String resolved = UrlUtils.resolve(pageUrl, src);
            if (resolved != null) {
                out.add(resolved);
            }
        }
        return List.copyOf(out);
    }
}
