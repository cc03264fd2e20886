package com.pagesentry.analyze.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A pending screenshot capture. {@code attempt} counts how many times the job already came back
 * out of the dead letter queue.
 */
public record ScreenshotJob(
    @JsonProperty("sub_url") String subUrl,
    @JsonProperty("keyword") String keyword,
    @JsonProperty("main_url") String mainUrl,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("attempt") int attempt
) {
    @JsonCreator
    public ScreenshotJob {
    }

    public ScreenshotJob(String subUrl, String keyword, String mainUrl, String taskId) {
        this(subUrl, keyword, mainUrl, taskId, 0);
    }

    public ScreenshotJob withAttempt(int newAttempt) {
        return new ScreenshotJob(subUrl, keyword, mainUrl, taskId, newAttempt);
    }
}
