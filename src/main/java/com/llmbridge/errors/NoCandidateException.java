package com.llmbridge.errors;

public class NoCandidateException extends BridgeException {

    public NoCandidateException(String message) {
        super(ErrorKind.NO_CANDIDATE, message);
    }
}
