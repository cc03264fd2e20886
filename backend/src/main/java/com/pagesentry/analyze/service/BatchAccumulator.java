package com.pagesentry.analyze.service;

import com.pagesentry.analyze.model.MatchCandidate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Running totals for one in-flight task. Not thread-safe; {@link TaskStateStore} guards access.
 */
public class BatchAccumulator {
    private final String taskId;
    private final String mainUrl;
    private final int maxSnippets;
    private final Set<String> claimedUrls = new HashSet<>();
    private final Set<String> subUrls = new LinkedHashSet<>();
    private final Set<String> candidateKeys = new HashSet<>();
    private final Set<String> categories = new TreeSet<>();
    private final List<String> keywords = new ArrayList<>();
    private final List<String> snippets = new ArrayList<>();
    private int totalMatches;
    private int lastBatchNum;

    BatchAccumulator(String taskId, String mainUrl, int maxSnippets) {
        this.taskId = taskId;
        this.mainUrl = mainUrl;
        this.maxSnippets = Math.max(1, maxSnippets);
    }

    boolean claim(String url) {
        return claimedUrls.add(url);
    }

    int fold(String url, List<MatchCandidate> candidates) {
        subUrls.add(url);
        int added = 0;
        for (MatchCandidate candidate : candidates) {
            if (!candidateKeys.add(url + "\u0000" + candidate.dedupeKey())) {
                continue;
            }
            added++;
            totalMatches++;
            categories.add(candidate.category());
            keywords.add(candidate.term());
            if (snippets.size() < maxSnippets) {
                snippets.add(candidate.snippet());
            }
        }
        return added;
    }

    void batchSeen(int batchNum) {
        lastBatchNum = Math.max(lastBatchNum, batchNum);
    }

    Snapshot snapshot() {
        return new Snapshot(
            taskId,
            mainUrl,
            List.copyOf(subUrls),
            List.copyOf(keywords),
            List.copyOf(categories),
            List.copyOf(snippets),
            subUrls.size(),
            totalMatches,
            lastBatchNum
        );
    }

    public record Snapshot(
        String taskId,
        String mainUrl,
        List<String> subUrls,
        List<String> keywords,
        List<String> categories,
        List<String> snippets,
        int totalPages,
        int totalMatches,
        int lastBatchNum
    ) {
    }
}
