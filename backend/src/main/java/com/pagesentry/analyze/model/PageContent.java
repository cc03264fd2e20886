package com.pagesentry.analyze.model;

public record PageContent(
    String url,
    String html
) {
    public boolean isUsable() {
        return url != null && !url.isBlank() && html != null && !html.isBlank();
    }
}
