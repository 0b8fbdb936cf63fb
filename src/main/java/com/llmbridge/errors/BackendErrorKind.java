package com.llmbridge.errors;

public enum BackendErrorKind {
    AUTH, QUOTA, INVALID_REQUEST, SERVER, TIMEOUT, UNKNOWN
}
