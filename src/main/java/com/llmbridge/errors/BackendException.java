package com.llmbridge.errors;

import java.time.Duration;

public class BackendException extends BridgeException {

    private final BackendErrorKind backendKind;
    private final String backend;
    private final int statusCode;
    private final Duration retryAfter;

    public BackendException(BackendErrorKind backendKind, String backend, int statusCode,
                            String message, Duration retryAfter, Throwable cause) {
        super(ErrorKind.BACKEND, message, isTransient(backendKind, retryAfter), cause);
        this.backendKind = backendKind;
        this.backend = backend;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public BackendException(BackendErrorKind backendKind, String backend, String message) {
        this(backendKind, backend, 0, message, null, null);
    }

    public BackendException(BackendErrorKind backendKind, String backend, String message, Throwable cause) {
        this(backendKind, backend, 0, message, null, cause);
    }

    static boolean isTransient(BackendErrorKind kind, Duration retryAfter) {
        return switch (kind) {
            case SERVER, TIMEOUT -> true;
            case QUOTA -> retryAfter != null;
            default -> false;
        };
    }

    public BackendErrorKind backendKind() { return backendKind; }

    public String backend() { return backend; }

    public int statusCode() { return statusCode; }

    public Duration retryAfter() { return retryAfter; }
}
