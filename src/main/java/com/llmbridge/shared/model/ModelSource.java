package com.llmbridge.shared.model;

public enum ModelSource {
    STATIC, REMOTE, STALE
}
