package com.llmbridge.observability;

import com.llmbridge.bridge.DispatchOutcome;
import com.llmbridge.shared.model.ErrorInfo;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.Usage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Lifecycle notification. START carries only identity; END carries provenance, usage and
 * outcome; ERROR carries the error and outcome FAILED. {@code failedOver} lists the backends
 * abandoned before the one named in {@code backend}.
 */
public record BridgeEvent(
    Type type,
    String requestId,
    String backend,
    String model,
    Duration duration,
    Usage usage,
    FinishReason finishReason,
    ErrorInfo error,
    int attempts,
    DispatchOutcome outcome,
    boolean streaming,
    boolean cached,
    List<String> failedOver,
    Instant timestamp
) {
    public enum Type { REQUEST_START, REQUEST_END, REQUEST_ERROR }

    public static BridgeEvent start(String requestId, boolean streaming, Instant at) {
        return new BridgeEvent(Type.REQUEST_START, requestId, null, null, Duration.ZERO, null, null,
                null, 0, null, streaming, false, List.of(), at);
    }

    public BridgeEvent {
        failedOver = failedOver == null ? List.of() : List.copyOf(failedOver);
    }

    public boolean isError() {
        return type == Type.REQUEST_ERROR;
    }
}
