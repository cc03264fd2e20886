package com.pagesentry.analyze.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pagesentry.analyze.model.DomainStat;

import java.util.List;

public record RenderDomainsResponse(
    @JsonProperty("domains") List<String> domains,
    @JsonProperty("escalated") List<DomainStat> escalated
) {
}
