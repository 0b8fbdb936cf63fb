package com.llmbridge.errors;

import java.time.Duration;

public class RateLimitException extends BridgeException {

    private final Duration retryAfter;

    public RateLimitException(String key, int limit, Duration retryAfter) {
        super(ErrorKind.RATE_LIMIT, "Rate limit exceeded for '" + key + "': max " + limit + " requests per window");
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() { return retryAfter; }
}
