package com.pagesentry.analyze.rules;

import java.util.List;
import java.util.Locale;

/**
 * Density of payment vocabulary around a match, in [0, 1]. Four distinct tokens saturate the score.
 */
public final class ContextScorer {
    static final List<String> PAYMENT_TOKENS = List.of(
        "buy", "order", "pay", "scan", "checkout", "upi", "gpay", "phonepe",
        "paytm", "payment", "merchant", "qr", "amount", "send", "transfer"
    );
    private static final double SATURATION = 4.0;

    private final int window;

    public ContextScorer(int window) {
        this.window = Math.max(1, window);
    }

    public double score(String text, int index) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        int from = Math.max(0, Math.min(index, text.length()) - window);
        int to = Math.min(text.length(), Math.max(0, index) + window);
        String region = text.substring(from, to).toLowerCase(Locale.ROOT);
        int present = 0;
        for (String token : PAYMENT_TOKENS) {
            if (region.contains(token)) {
                present++;
            }
        }
        return Math.min(present / SATURATION, 1.0);
    }
}
