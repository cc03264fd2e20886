package com.pagesentry.analyze.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    /**
     * Lower-cased host of {@code url} without a leading {@code www.}; null when unparseable.
     */
    public static String domainOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "http://" + candidate;
        }
        try {
            String host = new URI(candidate).getHost();
            if (host == null || host.isBlank()) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static String resolve(String baseUrl, String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        String trimmed = reference.trim();
        if (trimmed.startsWith("data:") || trimmed.startsWith("javascript:")) {
            return null;
        }
        try {
            URI resolved = baseUrl == null ? new URI(trimmed) : new URI(baseUrl.trim()).resolve(trimmed);
            String scheme = resolved.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return resolved.toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static String trimTrailingSlash(String baseUrl) {
        if (baseUrl == null) {
            return "";
        }
        String out = baseUrl.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
