package com.pagesentry.analyze.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DomainStat(
    @JsonProperty("domain") String domain,
    @JsonProperty("seen") long seen,
    @JsonProperty("render_success") long renderSuccess,
    @JsonProperty("escalated") boolean escalated
) {
    public static DomainStat empty(String domain) {
        return new DomainStat(domain, 0, 0, false);
    }
}
