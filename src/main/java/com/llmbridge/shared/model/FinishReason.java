package com.llmbridge.shared.model;

public enum FinishReason {
    STOP, LENGTH, TOOL_CALL, CONTENT_FILTER, ERROR
}
