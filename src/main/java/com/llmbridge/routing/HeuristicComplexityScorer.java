package com.llmbridge.routing;

import com.llmbridge.shared.model.ChatRequest;

public class HeuristicComplexityScorer implements ComplexityScorer {

    static final int CHARS_PER_TOKEN = 4;

    @Override
    public int score(ChatRequest request) {
        int inputTokens = request.totalTextLength() / CHARS_PER_TOKEN;
        double score = 0;
        score += Math.min(40, inputTokens / 100.0);
        var maxTokens = request.params().maxTokens();
        if (maxTokens != null) score += Math.min(20, maxTokens / 200.0);
        score += Math.min(15, Math.max(0, request.messages().size() - 1) * 1.5);
        if (request.hasTools()) score += 10;
        if (request.hasImages()) score += 10;
        if (request.params().jsonMode()) score += 5;
        return (int) Math.min(100, Math.round(score));
    }
}
