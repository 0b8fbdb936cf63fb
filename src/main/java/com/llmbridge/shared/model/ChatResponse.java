package com.llmbridge.shared.model;

import java.time.Duration;

public record ChatResponse(
    String requestId,
    Message message,
    FinishReason finishReason,
    Usage usage,
    String backend,
    String model,
    Duration duration,
    ResponseSource source
) {
    public ChatResponse {
        usage = usage != null ? usage : Usage.EMPTY;
        duration = duration != null ? duration : Duration.ZERO;
        source = source != null ? source : ResponseSource.BACKEND;
        finishReason = finishReason != null ? finishReason : FinishReason.STOP;
    }

    public static ChatResponse of(String requestId, String content, FinishReason finishReason, Usage usage) {
        return new ChatResponse(requestId, Message.assistant(content), finishReason, usage,
                null, null, Duration.ZERO, ResponseSource.BACKEND);
    }

    public String content() {
        return message != null ? message.textContent() : "";
    }

    public ChatResponse withRequestId(String requestId) {
        return new ChatResponse(requestId, message, finishReason, usage, backend, model, duration, source);
    }

    public ChatResponse withProvenance(String backend, String model) {
        return new ChatResponse(requestId, message, finishReason, usage, backend, model, duration, source);
    }

    public ChatResponse withDuration(Duration duration) {
        return new ChatResponse(requestId, message, finishReason, usage, backend, model, duration, source);
    }

    public ChatResponse withSource(ResponseSource source) {
        return new ChatResponse(requestId, message, finishReason, usage, backend, model, duration, source);
    }
}
