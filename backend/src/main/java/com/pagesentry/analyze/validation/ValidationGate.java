package com.pagesentry.analyze.validation;

import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.util.HashUtils;
import com.pagesentry.analyze.util.TextCleaner;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides which candidates become validated hits. Disabled, or backed by an unavailable scorer,
 * it scores everything 1.0.
 */
@Component
public class ValidationGate {
    private static final Logger log = LoggerFactory.getLogger(ValidationGate.class);
    private static final int CACHE_SNIPPET_CHARS = 200;

    private final MatchScorer scorer;
    private final boolean enabled;
    private final double threshold;
    private final int cacheMaxEntries;
    private final Map<String, Double> cache = new ConcurrentHashMap<>();

    public ValidationGate(MatchScorer scorer, AnalyzerProperties properties) {
        this.scorer = scorer;
        AnalyzerProperties.Validation validation = properties.getValidation();
        this.enabled = validation.isEnabled();
        this.threshold = validation.getThreshold();
        this.cacheMaxEntries = validation.getCacheMaxEntries();
        if (enabled && !scorer.isAvailable()) {
            log.warn("Validation enabled but no scorer model is available; passing all candidates");
        }
    }

    public boolean isActive() {
        return enabled && scorer.isAvailable();
    }

    public double score(MatchCandidate candidate) {
        return score(candidate.term(), candidate.snippet(), candidate.category());
    }

    public double score(String keyword, String snippet, String category) {
        if (!isActive()) {
            return 1.0;
        }
        String key = cacheKey(keyword, snippet, category);
        Double cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        double value;
        try {
            value = clamp(scorer.score(keyword, snippet, category));
        } catch (RuntimeException e) {
            log.warn("Scorer failed keyword={} category={}: {}", keyword, category, e.getMessage());
            return 0.0;
        }
        if (cache.size() >= cacheMaxEntries) {
            cache.clear();
        }
        cache.put(key, value);
        return value;
    }

    public boolean passes(double score) {
        return !isActive() || score >= threshold;
    }

    int cacheSize() {
        return cache.size();
    }

    static String cacheKey(String keyword, String snippet, String category) {
        return HashUtils.sha256Hex(category + "|" + keyword + "|" + TextCleaner.truncate(snippet == null ? "" : snippet, CACHE_SNIPPET_CHARS));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
