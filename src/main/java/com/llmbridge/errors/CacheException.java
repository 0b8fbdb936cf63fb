package com.llmbridge.errors;

public class CacheException extends BridgeException {

    public CacheException(String message, Throwable cause) {
        super(ErrorKind.CACHE, message, false, cause);
    }
}
