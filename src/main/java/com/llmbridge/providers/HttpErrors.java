package com.llmbridge.providers;

import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;

import java.io.IOException;
import java.net.http.HttpHeaders;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HttpErrors {

    private static final long RETRY_AFTER_CAP_MS = 30_000;
    private static final int MAX_BODY_IN_MESSAGE = 500;
    private static final Pattern RETRY_AFTER = Pattern.compile(
            "(?i)retry[_-]after[\"':\\s]+([\\d.]+)");

    private HttpErrors() {}

    public static BackendErrorKind classify(int status) {
        if (status == 401 || status == 403) return BackendErrorKind.AUTH;
        if (status == 429) return BackendErrorKind.QUOTA;
        if (status == 408 || status == 504) return BackendErrorKind.TIMEOUT;
        if (status >= 400 && status < 500) return BackendErrorKind.INVALID_REQUEST;
        if (status >= 500) return BackendErrorKind.SERVER;
        return BackendErrorKind.UNKNOWN;
    }

    public static BackendException fromResponse(String backend, int status, HttpHeaders headers, String body) {
        var kind = classify(status);
        Duration retryAfter = null;
        if (kind == BackendErrorKind.QUOTA) {
            retryAfter = headers != null
                    ? headers.firstValue("retry-after").map(HttpErrors::parseSeconds).orElse(null)
                    : null;
            if (retryAfter == null) retryAfter = parseRetryAfter(body);
        }
        var snippet = body == null ? "" : body.length() > MAX_BODY_IN_MESSAGE
                ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..." : body;
        return new BackendException(kind, backend, status,
                backend + " API error " + status + ": " + snippet, retryAfter, null);
    }

    public static BackendException fromIo(String backend, IOException e) {
        if (e instanceof HttpTimeoutException) {
            return new BackendException(BackendErrorKind.TIMEOUT, backend, backend + " request timed out", e);
        }
        return new BackendException(BackendErrorKind.SERVER, backend,
                backend + " unreachable: " + e.getMessage(), e);
    }

    public static BackendException interrupted(String backend, InterruptedException e) {
        Thread.currentThread().interrupt();
        return new BackendException(BackendErrorKind.TIMEOUT, backend, backend + " call interrupted", e);
    }

    static Duration parseRetryAfter(String text) {
        if (text == null) return null;
        Matcher m = RETRY_AFTER.matcher(text);
        return m.find() ? parseSeconds(m.group(1)) : null;
    }

    static Duration parseSeconds(String value) {
        try {
            double secs = Double.parseDouble(value.trim());
            if (Double.isFinite(secs) && secs >= 0) {
                return Duration.ofMillis(Math.min((long) (secs * 1000), RETRY_AFTER_CAP_MS));
            }
        } catch (NumberFormatException e) {
            // HTTP-date form is not supported; caller falls back to its own backoff
            return null;
        }
        return null;
    }
}
