package com.pagesentry.analyze.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record DeadLetterStats(
    @JsonProperty("available") boolean available,
    @JsonProperty("hit_queue_size") long hitQueueSize,
    @JsonProperty("screenshot_queue_size") long screenshotQueueSize,
    @JsonProperty("metrics") Map<String, Double> metrics
) {
}
