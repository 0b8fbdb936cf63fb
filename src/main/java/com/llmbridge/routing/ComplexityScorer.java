package com.llmbridge.routing;

import com.llmbridge.shared.model.ChatRequest;

@FunctionalInterface
public interface ComplexityScorer {
    int score(ChatRequest request);
}
