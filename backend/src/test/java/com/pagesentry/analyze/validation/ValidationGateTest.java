package com.pagesentry.analyze.validation;

import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.MatchSource;
import com.pagesentry.config.AnalyzerProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationGateTest {

    @Test
    void disabledGatePassesEverything() {
        CountingScorer scorer = new CountingScorer(0.1);
        ValidationGate gate = new ValidationGate(scorer, properties(false, 10));

        assertFalse(gate.isActive());
        assertEquals(1.0, gate.score("weed", "some snippet", "narcotics"));
        assertTrue(gate.passes(0.0));
        assertEquals(0, scorer.calls.get());
    }

    @Test
    void unavailableScorerIsPassThrough() {
        MatchScorer unavailable = new MatchScorer() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public double score(String keyword, String snippet, String category) {
                throw new AssertionError("not called");
            }
        };
        ValidationGate gate = new ValidationGate(unavailable, properties(true, 10));

        assertEquals(1.0, gate.score("weed", "snippet", "narcotics"));
        assertTrue(gate.passes(0.2));
    }

    @Test
    void cachesScoresAndAppliesThreshold() {
        CountingScorer scorer = new CountingScorer(0.6);
        ValidationGate gate = new ValidationGate(scorer, properties(true, 10));
        MatchCandidate candidate = new MatchCandidate("weed", "narcotics", "buy weed here", MatchSource.REGEX, 1.0);

        double first = gate.score(candidate);
        double second = gate.score(candidate);

        assertEquals(0.6, first);
        assertEquals(first, second);
        assertEquals(1, scorer.calls.get());
        assertFalse(gate.passes(first));
        assertTrue(gate.passes(0.75));
    }

    @Test
    void clearsCacheWhenFull() {
        CountingScorer scorer = new CountingScorer(0.9);
        ValidationGate gate = new ValidationGate(scorer, properties(true, 2));

        gate.score("a", "s1", "c");
        gate.score("b", "s2", "c");
        assertEquals(2, gate.cacheSize());
        gate.score("c", "s3", "c");

        assertEquals(1, gate.cacheSize());
    }

    @Test
    void scorerFailureScoresZeroWithoutCaching() {
        MatchScorer failing = new MatchScorer() {
            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public double score(String keyword, String snippet, String category) {
                throw new IllegalStateException("model timeout");
            }
        };
        ValidationGate gate = new ValidationGate(failing, properties(true, 10));

        assertEquals(0.0, gate.score("weed", "snippet", "narcotics"));
        assertEquals(0, gate.cacheSize());
    }

    @Test
    void cacheKeyUsesTruncatedSnippet() {
        String base = "x".repeat(200);
        assertEquals(
            ValidationGate.cacheKey("k", base + "tail-one", "c"),
            ValidationGate.cacheKey("k", base + "tail-two", "c")
        );
        assertNotEquals(ValidationGate.cacheKey("k", "s", "c1"), ValidationGate.cacheKey("k", "s", "c2"));
    }

    private static AnalyzerProperties properties(boolean enabled, int cacheMax) {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getValidation().setEnabled(enabled);
        properties.getValidation().setThreshold(0.75);
        properties.getValidation().setCacheMaxEntries(cacheMax);
        return properties;
    }

    private static final class CountingScorer implements MatchScorer {
        private final double value;
        private final AtomicInteger calls = new AtomicInteger();

        private CountingScorer(double value) {
            this.value = value;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public double score(String keyword, String snippet, String category) {
            calls.incrementAndGet();
            return value;
        }
    }
}
