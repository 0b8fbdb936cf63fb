package com.llmbridge.errors;

public class StreamException extends BridgeException {

    public StreamException(String message, Throwable cause) {
        super(ErrorKind.STREAM, message, false, cause);
    }
}
