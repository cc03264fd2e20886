package com.pagesentry.analyze.rules;

import com.pagesentry.analyze.model.KeywordRule;
import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.MatchSource;
import com.pagesentry.analyze.util.TextCleaner;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies the compiled keyword corpus plus the built-in UPI handle and crypto address patterns
 * to cleaned page text.
 */
@Component
public class RuleMatcher {
    private static final Logger log = LoggerFactory.getLogger(RuleMatcher.class);

    static final Pattern UPI_HANDLE = Pattern.compile(
        "\\b[a-zA-Z0-9._-]{2,}@(upi|paytm|ybl|okicici|oksbi|okaxis|okhdfcbank|ibl|axl|idfcbank|apl|payu|pingpay|barodampay|boi|zomato)\\b",
        Pattern.CASE_INSENSITIVE
    );
    static final Pattern BITCOIN_ADDRESS = Pattern.compile("\\b[13][a-km-zA-HJ-NP-Z1-9]{25,34}\\b");
    static final Pattern ETHEREUM_ADDRESS = Pattern.compile("\\b0x[a-fA-F0-9]{40}\\b");

    public static final String UPI_HANDLE_TERM = "upi-handle";
    public static final String CRYPTO_CATEGORY = "crypto";
    private static final int ADDRESS_SNIPPET_WINDOW = 80;
    private static final int MIN_ALIAS_LENGTH = 3;
    private static final double UPI_BASE_CONFIDENCE = 0.85;
    private static final double CRYPTO_BASE_CONFIDENCE = 0.95;

    private final List<CompiledPattern> patterns;
    private final List<AliasRule> aliases;
    private final ContextScorer contextScorer;
    private final double paymentThreshold;
    private final double aliasThreshold;
    private final int snippetWindow;

    @Autowired
    public RuleMatcher(KeywordCorpusLoader loader, AnalyzerProperties properties) {
        this(loader.load(properties.getRules().getKeywordsFile()), properties.getRules());
    }

    public RuleMatcher(List<KeywordRule> rules, AnalyzerProperties.Rules config) {
        this.patterns = compilePatterns(rules);
        this.aliases = collectAliases(rules);
        this.contextScorer = new ContextScorer(config.getContextWindow());
        this.paymentThreshold = config.getPaymentContextThreshold();
        this.aliasThreshold = config.getAliasContextThreshold();
        this.snippetWindow = config.getSnippetWindow();
    }

    public int patternCount() {
        return patterns.size();
    }

    public int aliasCount() {
        return aliases.size();
    }

    /**
     * Candidates for {@code rawText}, de-duplicated by (term, category, snippet) in discovery order.
     */
    public List<MatchCandidate> match(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return List.of();
        }
        String text = TextCleaner.clean(rawText);
        String lower = text.toLowerCase(Locale.ROOT);
        List<MatchCandidate> found = new ArrayList<>();

        for (CompiledPattern rule : patterns) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                addGated(found, text, matcher.start(), rule.term(), rule.category(), MatchSource.REGEX, paymentThreshold);
            }
        }

        for (AliasRule rule : aliases) {
            int idx = lower.indexOf(rule.alias());
            if (idx >= 0) {
                addGated(found, text, idx, rule.term(), rule.category(), MatchSource.ALIAS, aliasThreshold);
            }
        }

        Matcher upi = UPI_HANDLE.matcher(text);
        while (upi.find()) {
            double ctx = contextScorer.score(text, upi.start());
            if (ctx >= paymentThreshold) {
                String snippet = TextCleaner.window(text, upi.start(), upi.start(), ADDRESS_SNIPPET_WINDOW);
                found.add(new MatchCandidate(
                    UPI_HANDLE_TERM, MatchCandidate.PAYMENTS, snippet, MatchSource.CONTEXT, UPI_BASE_CONFIDENCE * ctx
                ));
            }
        }

        addAddresses(found, text, BITCOIN_ADDRESS, "bitcoin");
        addAddresses(found, text, ETHEREUM_ADDRESS, "ethereum");
        return dedupe(found);
    }

    public static List<MatchCandidate> dedupe(List<MatchCandidate> candidates) {
        Map<String, MatchCandidate> unique = new LinkedHashMap<>();
        for (MatchCandidate candidate : candidates) {
            unique.putIfAbsent(candidate.dedupeKey(), candidate);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Lower-cased UPI handles appearing in {@code text}, in order, without repeats.
     */
    public static List<String> upiHandlesIn(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> handles = new LinkedHashSet<>();
        Matcher matcher = UPI_HANDLE.matcher(text);
        while (matcher.find()) {
            handles.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(handles);
    }

    private void addGated(
        List<MatchCandidate> found,
        String text,
        int index,
        String term,
        String category,
        MatchSource source,
        double threshold
    ) {
        double weight = 1.0;
        if (MatchCandidate.PAYMENTS.equals(category)) {
            weight = contextScorer.score(text, index);
            if (weight < threshold) {
                return;
            }
        }
        String snippet = TextCleaner.window(text, index, index, snippetWindow);
        found.add(new MatchCandidate(term, category, snippet, source, weight));
    }

    private static void addAddresses(List<MatchCandidate> found, String text, Pattern pattern, String term) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String snippet = TextCleaner.window(text, matcher.start(), matcher.start(), ADDRESS_SNIPPET_WINDOW);
            found.add(new MatchCandidate(term, CRYPTO_CATEGORY, snippet, MatchSource.REGEX, CRYPTO_BASE_CONFIDENCE));
        }
    }

    private static List<CompiledPattern> compilePatterns(List<KeywordRule> rules) {
        List<CompiledPattern> out = new ArrayList<>();
        for (KeywordRule rule : rules) {
            for (String pattern : rule.patterns()) {
                try {
                    out.add(new CompiledPattern(rule.term(), rule.category(),
                        Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
                } catch (PatternSyntaxException e) {
                    log.warn("Skipping invalid pattern for term={} category={}: {}", rule.term(), rule.category(), e.getDescription());
                }
            }
        }
        return List.copyOf(out);
    }

    private static List<AliasRule> collectAliases(List<KeywordRule> rules) {
        List<AliasRule> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (KeywordRule rule : rules) {
            List<String> names = new ArrayList<>(rule.aliases());
            names.addAll(rule.brands());
            for (String name : names) {
                String alias = name.trim().toLowerCase(Locale.ROOT);
                if (alias.length() < MIN_ALIAS_LENGTH) {
                    continue;
                }
                if (seen.add(rule.term() + "\u0000" + rule.category() + "\u0000" + alias)) {
                    out.add(new AliasRule(rule.term(), rule.category(), alias));
                }
            }
        }
        return List.copyOf(out);
    }

    private record CompiledPattern(String term, String category, Pattern pattern) {
    }

    private record AliasRule(String term, String category, String alias) {
    }
}
