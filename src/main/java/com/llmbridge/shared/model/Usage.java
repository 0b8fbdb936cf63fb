package com.llmbridge.shared.model;

public record Usage(int promptTokens, int completionTokens, int totalTokens) {

    public static final Usage EMPTY = new Usage(0, 0, 0);

    public static Usage of(int promptTokens, int completionTokens) {
        return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
    }

    public Usage plus(Usage other) {
        if (other == null) return this;
        return of(promptTokens + other.promptTokens, completionTokens + other.completionTokens);
    }
}
