package com.pagesentry.analyze.model;

import java.time.Instant;
import java.util.List;

public record ResultRecord(
    String taskId,
    String mainUrl,
    List<String> subUrls,
    List<String> keywords,
    List<String> categories,
    String snippets,
    int totalPages,
    int totalMatches,
    Instant timestamp
) {
}
