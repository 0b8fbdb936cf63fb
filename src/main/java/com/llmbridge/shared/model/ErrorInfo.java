package com.llmbridge.shared.model;

import com.llmbridge.errors.BridgeException;
import com.llmbridge.errors.ErrorKind;

public record ErrorInfo(ErrorKind kind, String message) {

    public static ErrorInfo from(Throwable t) {
        if (t instanceof BridgeException be) {
            return new ErrorInfo(be.kind(), be.getMessage());
        }
        return new ErrorInfo(ErrorKind.INTERNAL, t.getMessage());
    }
}
