package com.llmbridge.providers;

import java.time.Duration;
import java.util.List;

public record BackendSettings(
    String name,
    String baseUrl,
    String apiKey,
    String defaultModel,
    List<String> models,
    double costPer1kTokens,
    Duration timeout,
    Duration modelTtl
) {
    public BackendSettings {
        models = models != null ? List.copyOf(models) : List.of();
        timeout = timeout != null ? timeout : Duration.ofSeconds(30);
        modelTtl = modelTtl != null ? modelTtl : Duration.ofHours(1);
        if (baseUrl != null) baseUrl = baseUrl.replaceAll("/+$", "");
    }

    public static BackendSettings of(String name, String baseUrl, String apiKey, String defaultModel) {
        return new BackendSettings(name, baseUrl, apiKey, defaultModel, List.of(), 0.0, null, null);
    }

    public BackendSettings withBaseUrl(String baseUrl) {
        return new BackendSettings(name, baseUrl, apiKey, defaultModel, models, costPer1kTokens, timeout, modelTtl);
    }

    public BackendSettings withDefaultModel(String defaultModel) {
        return new BackendSettings(name, baseUrl, apiKey, defaultModel, models, costPer1kTokens, timeout, modelTtl);
    }

    public BackendSettings withCost(double costPer1kTokens) {
        return new BackendSettings(name, baseUrl, apiKey, defaultModel, models, costPer1kTokens, timeout, modelTtl);
    }

    public BackendSettings withModels(List<String> models) {
        return new BackendSettings(name, baseUrl, apiKey, defaultModel, models, costPer1kTokens, timeout, modelTtl);
    }
}
