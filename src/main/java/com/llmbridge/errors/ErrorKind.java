package com.llmbridge.errors;

public enum ErrorKind {
    VALIDATION, NO_CANDIDATE, RATE_LIMIT, BACKEND, TIMEOUT, STREAM, CACHE, INTERNAL
}
