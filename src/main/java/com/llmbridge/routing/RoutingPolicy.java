package com.llmbridge.routing;

import com.llmbridge.shared.model.ChatRequest;

import java.util.List;
import java.util.Map;

public record RoutingPolicy(
    ComplexityScorer scorer,
    int moderateThreshold,
    int complexThreshold,
    Map<CostTier, List<String>> preferences,
    Map<String, Double> costOverrides
) {
    public RoutingPolicy {
        if (scorer == null) scorer = new HeuristicComplexityScorer();
        if (moderateThreshold > complexThreshold) {
            throw new IllegalArgumentException("moderate threshold above complex threshold");
        }
        preferences = preferences != null ? Map.copyOf(preferences) : Map.of();
        costOverrides = costOverrides != null ? Map.copyOf(costOverrides) : Map.of();
    }

    public static RoutingPolicy of(Map<CostTier, List<String>> preferences) {
        return new RoutingPolicy(new HeuristicComplexityScorer(), 30, 70, preferences, Map.of());
    }

    public CostTier tierFor(ChatRequest request) {
        int score = scorer.score(request);
        if (score >= complexThreshold) return CostTier.COMPLEX;
        if (score >= moderateThreshold) return CostTier.MODERATE;
        return CostTier.SIMPLE;
    }

    public List<String> preferencesFor(CostTier tier) {
        return preferences.getOrDefault(tier, List.of());
    }
}
