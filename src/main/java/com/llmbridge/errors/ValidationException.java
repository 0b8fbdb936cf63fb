package com.llmbridge.errors;

public class ValidationException extends BridgeException {

    private final String field;

    public ValidationException(String field, String reason) {
        super(ErrorKind.VALIDATION, field != null ? field + ": " + reason : reason);
        this.field = field;
    }

    public String field() { return field; }
}
