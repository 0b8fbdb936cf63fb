package com.llmbridge.errors;

import java.time.Duration;

public class DeadlineExceededException extends BridgeException {

    public DeadlineExceededException(String requestId, Duration timeout) {
        this(requestId, timeout, null);
    }

    public DeadlineExceededException(String requestId, Duration timeout, Throwable cause) {
        super(ErrorKind.TIMEOUT, "Request " + requestId + " exceeded deadline of " + timeout.toMillis() + "ms",
                false, cause);
    }
}
