package com.pagesentry.analyze.model;

import java.util.List;

public record PageMatchResult(
    String url,
    List<MatchCandidate> candidates,
    boolean rendered
) {
}
