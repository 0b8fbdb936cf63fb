package com.llmbridge.shared.model;

import java.util.List;

public record GenerationParams(
    Double temperature,
    Integer maxTokens,
    Double topP,
    List<String> stopSequences,
    boolean jsonMode
) {
    public GenerationParams {
        stopSequences = stopSequences != null ? List.copyOf(stopSequences) : List.of();
    }

    public static GenerationParams defaults() {
        return new GenerationParams(null, null, null, List.of(), false);
    }

    public GenerationParams withMaxTokens(Integer maxTokens) {
        return new GenerationParams(temperature, maxTokens, topP, stopSequences, jsonMode);
    }

    public GenerationParams withJsonMode(boolean jsonMode) {
        return new GenerationParams(temperature, maxTokens, topP, stopSequences, jsonMode);
    }

    public GenerationParams withTemperature(Double temperature) {
        return new GenerationParams(temperature, maxTokens, topP, stopSequences, jsonMode);
    }
}
