package com.pagesentry.analyze.model;

/**
 * Outcome of a collaborator call: a value, or a stable error code with detail.
 */
public record StageResult<T>(
    T value,
    String errorCode,
    String errorMessage
) {
    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(value, null, null);
    }

    public static <T> StageResult<T> failed(String errorCode, String errorMessage) {
        return new StageResult<>(null, errorCode, errorMessage);
    }

    public boolean isOk() {
        return errorCode == null;
    }
}
