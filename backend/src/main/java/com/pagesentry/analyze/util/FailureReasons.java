package com.pagesentry.analyze.util;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

public final class FailureReasons {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INTERRUPTED = "interrupted";
    public static final String INVALID_URL = "invalid_url";
    public static final String HTTP_4XX = "http_4xx";
    public static final String HTTP_5XX = "http_5xx";
    public static final String EMPTY_RESPONSE = "empty_response";
    public static final String NOT_HTML = "not_html";
    public static final String TOO_LARGE = "too_large";
    public static final String PARSE_ERROR = "parse_error";
    public static final String DISABLED = "disabled";
    public static final String UNKNOWN = "unknown";

    public static final String HIT_QUEUE_FULL = "hit_queue_full";
    public static final String SCREENSHOT_QUEUE_FULL = "screenshot_queue_full";
    public static final String DB_FLUSH_TIMEOUT = "db_flush_timeout";
    public static final String DB_FLUSH_ERROR = "db_flush_error";
    public static final String RENDER_FAILED = "render_failed";
    public static final String UPLOAD_FAILED = "upload_failed";
    public static final String ATTACH_FAILED = "attach_failed";
    public static final String SHUTDOWN = "shutdown";

    private FailureReasons() {
    }

    public static String fromHttpStatus(int status) {
        if (status >= 400 && status < 500) {
            return status == 408 ? TIMEOUT : HTTP_4XX;
        }
        if (status >= 500 && status < 600) {
            return HTTP_5XX;
        }
        return UNKNOWN;
    }

    public static String fromException(Throwable error) {
        if (error == null) {
            return UNKNOWN;
        }
        if (error instanceof HttpTimeoutException
            || error instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof InterruptedException) {
            return INTERRUPTED;
        }
        if (error instanceof IOException) {
            String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
            return message.contains("timed out") ? TIMEOUT : IO_ERROR;
        }
        if (error instanceof IllegalArgumentException) {
            return INVALID_URL;
        }
        return UNKNOWN;
    }
}
