package com.pagesentry.analyze.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FailedScreenshot(
    @JsonProperty("job") ScreenshotJob job,
    @JsonProperty("error") String error,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("created_at") Instant createdAt
) {
    /**
     * A fresh dead letter; the retry count resumes from the attempts the job already used.
     */
    public static FailedScreenshot of(ScreenshotJob job, String error) {
        return new FailedScreenshot(job, error, job.attempt(), Instant.now());
    }

    public FailedScreenshot retried(String newError) {
        return new FailedScreenshot(job, newError, retryCount + 1, Instant.now());
    }
}
