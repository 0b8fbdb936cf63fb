package com.llmbridge.bridge;

public enum DispatchOutcome {
    SUCCESS, RETRIED_SUCCESS, FAILED
}
