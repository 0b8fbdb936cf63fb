package com.llmbridge.shared.model;

public enum ResponseSource {
    BACKEND, CACHE
}
