package com.llmbridge.errors;

public class BridgeException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;

    public BridgeException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public BridgeException(ErrorKind kind, String message) {
        this(kind, message, false, null);
    }

    public static BridgeException internal(String message, Throwable cause) {
        return new BridgeException(ErrorKind.INTERNAL, message, false, cause);
    }

    public ErrorKind kind() { return kind; }

    public boolean retryable() { return retryable; }
}
