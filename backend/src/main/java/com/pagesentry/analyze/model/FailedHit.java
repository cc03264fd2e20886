package com.pagesentry.analyze.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FailedHit(
    @JsonProperty("hit") ValidatedHit hit,
    @JsonProperty("error") String error,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("created_at") Instant createdAt
) {
    /**
     * A fresh dead letter; the retry count resumes from the attempts the hit already used.
     */
    public static FailedHit of(ValidatedHit hit, String error) {
        return new FailedHit(hit, error, hit.attempt(), Instant.now());
    }

    public FailedHit retried(String newError) {
        return new FailedHit(hit, newError, retryCount + 1, Instant.now());
    }
}
