package com.llmbridge.bridge;

import com.llmbridge.routing.CapabilityFilter;

import java.time.Duration;

public record DispatchOptions(
    String backend,
    CapabilityFilter filter,
    Duration timeout,
    Duration attemptTimeout,
    boolean forceRefresh
) {
    public static DispatchOptions defaults() {
        return new DispatchOptions(null, null, null, null, false);
    }

    public DispatchOptions withBackend(String backend) {
        return new DispatchOptions(backend, filter, timeout, attemptTimeout, forceRefresh);
    }

    public DispatchOptions withFilter(CapabilityFilter filter) {
        return new DispatchOptions(backend, filter, timeout, attemptTimeout, forceRefresh);
    }

    public DispatchOptions withTimeout(Duration timeout) {
        return new DispatchOptions(backend, filter, timeout, attemptTimeout, forceRefresh);
    }

    public DispatchOptions withAttemptTimeout(Duration attemptTimeout) {
        return new DispatchOptions(backend, filter, timeout, attemptTimeout, forceRefresh);
    }

    public DispatchOptions withForceRefresh(boolean forceRefresh) {
        return new DispatchOptions(backend, filter, timeout, attemptTimeout, forceRefresh);
    }
}
