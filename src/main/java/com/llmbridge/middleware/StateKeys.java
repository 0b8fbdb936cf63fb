package com.llmbridge.middleware;

public final class StateKeys {

    public static final String SELECTION = "routing.selection";
    public static final String PINNED_BACKEND = "routing.pinned";
    public static final String FAILED_OVER = "routing.failed-over";
    public static final String FINGERPRINT = "cache.fingerprint";
    public static final String CACHE_HIT = "cache.hit";
    public static final String COST_ESTIMATE = "cost.estimate";
    public static final String RETRIES = "retry.count";

    private StateKeys() {}
}
