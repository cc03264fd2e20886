package com.pagesentry.analyze.validation;

/**
 * Semantic plausibility of a keyword match, in [0, 1].
 */
public interface MatchScorer {
    /**
     * False when the underlying model could not be initialised; the gate then passes everything.
     */
    boolean isAvailable();

    double score(String keyword, String snippet, String category);
}
