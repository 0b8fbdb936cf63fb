package com.llmbridge.middleware;

import com.llmbridge.errors.BackendException;
import com.llmbridge.errors.BridgeException;

import java.time.Duration;
import java.util.function.DoubleSupplier;

public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    double multiplier,
    double jitterMin,
    double jitterMax
) {
    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (jitterMin < 0 || jitterMax < jitterMin) throw new IllegalArgumentException("invalid jitter bounds");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(10), 2.0, 0.5, 1.0);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 1.0, 1.0);
    }

    public boolean shouldRetry(Throwable error) {
        return error instanceof BridgeException be && be.retryable();
    }

    public Duration delayFor(int failedAttempt, Throwable error, DoubleSupplier random) {
        double raw = baseDelay.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        double capped = Math.min(raw, maxDelay.toMillis());
        double jitter = jitterMin + (jitterMax - jitterMin) * random.getAsDouble();
        var delay = Duration.ofMillis(Math.round(capped * jitter));
        if (error instanceof BackendException be && be.retryAfter() != null
                && be.retryAfter().compareTo(delay) > 0) {
            return be.retryAfter();
        }
        return delay;
    }
}
