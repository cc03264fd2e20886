package com.pagesentry.analyze.model;

import java.util.List;

public record KeywordRule(
    String term,
    String category,
    List<String> patterns,
    List<String> aliases,
    List<String> brands
) {
    public KeywordRule {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        brands = brands == null ? List.of() : List.copyOf(brands);
    }
}
