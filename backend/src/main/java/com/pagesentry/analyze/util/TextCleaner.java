package com.pagesentry.analyze.util;

import java.util.regex.Pattern;

public final class TextCleaner {
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\t\\r\\n]+");
    private static final Pattern SPACE_RUNS = Pattern.compile("\\s{2,}");
    private static final Pattern NON_PRINTABLE = Pattern.compile("[^\\x20-\\x7E]+");

    private TextCleaner() {
    }

    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String out = LINE_BREAKS.matcher(text).replaceAll(" ");
        out = SPACE_RUNS.matcher(out).replaceAll(" ");
        out = NON_PRINTABLE.matcher(out).replaceAll(" ");
        // non-printable replacement can leave fresh runs behind
        out = SPACE_RUNS.matcher(out).replaceAll(" ");
        return out.trim();
    }

    /**
     * Cleaned window of {@code radius} characters either side of {@code [start, end)}.
     */
    public static String window(String text, int start, int end, int radius) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int from = Math.max(0, start - radius);
        int to = Math.min(text.length(), end + radius);
        return clean(text.substring(from, to));
    }

    public static String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }
}
