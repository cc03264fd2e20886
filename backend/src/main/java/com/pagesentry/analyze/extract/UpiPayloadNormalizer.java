package com.pagesentry.analyze.extract;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class UpiPayloadNormalizer {
    private static final Pattern GENERIC_HANDLE = Pattern.compile("\\b[a-zA-Z0-9._-]{3,}@[a-zA-Z]{2,}\\b");

    private UpiPayloadNormalizer() {
    }

    /**
     * Payee handle from a {@code upi://pay?pa=...} / {@code upi:pay?pa=...} payload, else the first
     * generic {@code name@provider} handle in the text. Lower-cased.
     */
    public static Optional<String> normalize(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        String data = payload.trim();
        String lower = data.toLowerCase(Locale.ROOT);
        if (lower.startsWith("upi:")) {
            int query = data.indexOf('?');
            if (query >= 0) {
                for (String pair : data.substring(query + 1).split("&")) {
                    int eq = pair.indexOf('=');
                    if (eq > 0 && pair.substring(0, eq).equalsIgnoreCase("pa")) {
                        String value = decode(pair.substring(eq + 1)).trim();
                        if (!value.isEmpty()) {
                            return Optional.of(value.toLowerCase(Locale.ROOT));
                        }
                    }
                }
            }
        }
        Matcher matcher = GENERIC_HANDLE.matcher(data);
        if (matcher.find()) {
            return Optional.of(matcher.group().toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
