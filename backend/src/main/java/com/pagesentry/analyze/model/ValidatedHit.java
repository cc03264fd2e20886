package com.pagesentry.analyze.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ValidatedHit(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("main_url") String mainUrl,
    @JsonProperty("sub_url") String subUrl,
    @JsonProperty("category") String category,
    @JsonProperty("matched_keyword") String keyword,
    @JsonProperty("snippet") String snippet,
    @JsonProperty("source") String source,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("screenshot_path") String screenshotPath,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("attempt") int attempt
) {
    @JsonCreator
    public ValidatedHit {
    }

    public ValidatedHit(
        String taskId,
        String mainUrl,
        String subUrl,
        String category,
        String keyword,
        String snippet,
        String source,
        double confidence,
        String screenshotPath,
        Instant timestamp
    ) {
        this(taskId, mainUrl, subUrl, category, keyword, snippet, source, confidence, screenshotPath, timestamp, 0);
    }

    public ValidatedHit withAttempt(int newAttempt) {
        return new ValidatedHit(
            taskId, mainUrl, subUrl, category, keyword, snippet, source, confidence, screenshotPath, timestamp, newAttempt
        );
    }

    public ScreenshotJob toScreenshotJob() {
        return new ScreenshotJob(subUrl, keyword, mainUrl, taskId);
    }
}
