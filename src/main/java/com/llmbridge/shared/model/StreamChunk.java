package com.llmbridge.shared.model;

public record StreamChunk(
    long sequence,
    String delta,
    FinishReason finishReason,
    Usage usage,
    ErrorInfo error
) {
    public StreamChunk {
        delta = delta != null ? delta : "";
    }

    public static StreamChunk delta(String text) {
        return new StreamChunk(-1, text, null, null, null);
    }

    public static StreamChunk finish(FinishReason reason, Usage usage) {
        return new StreamChunk(-1, "", reason, usage, null);
    }

    public static StreamChunk failure(ErrorInfo error) {
        return new StreamChunk(-1, "", FinishReason.ERROR, null, error);
    }

    public boolean isTerminal() {
        return finishReason != null;
    }

    public StreamChunk withSequence(long sequence) {
        return new StreamChunk(sequence, delta, finishReason, usage, error);
    }
}
