package com.pagesentry.analyze.model;

public record ScreenshotCapture(
    byte[] image,
    String contentType,
    int matchCount
) {
}
