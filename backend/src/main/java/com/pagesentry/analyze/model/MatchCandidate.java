package com.pagesentry.analyze.model;

/**
 * A raw rule match before validation.
 *
 * @param weight multiplier applied to the validation score when the candidate becomes a hit:
 *               the context score for payment matches, a fixed base for address and handle
 *               matches, 1.0 otherwise
 */
public record MatchCandidate(
    String term,
    String category,
    String snippet,
    MatchSource source,
    double weight
) {
    public static final String PAYMENTS = "payments";

    public boolean isPayments() {
        return PAYMENTS.equals(category);
    }

    public String dedupeKey() {
        return term + "\u0000" + category + "\u0000" + snippet;
    }

    public MatchCandidate withSource(MatchSource newSource) {
        return new MatchCandidate(term, category, snippet, newSource, weight);
    }
}
