package com.pagesentry.analyze.api;

public record RenderDomainRequest(String domain) {
}
