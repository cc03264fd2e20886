package com.pagesentry.analyze.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record UpiHandleSighting(
    @JsonProperty("handle") String handle,
    @JsonProperty("domain") String domain,
    @JsonProperty("sightings") long sightings,
    @JsonProperty("sample_url") String sampleUrl,
    @JsonProperty("last_seen_at") Instant lastSeenAt
) {
}
