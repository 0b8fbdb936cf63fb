package com.llmbridge.providers;

import com.llmbridge.cache.ModelCache;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

public class OllamaBackend extends OpenAiCompatibleBackend {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434/v1";
    static final Duration MIN_TIMEOUT = Duration.ofSeconds(120);

    public OllamaBackend(BackendSettings settings, HttpClient httpClient, ModelCache cache) {
        super(normalize(settings), Capabilities.textOnly(8_192),
                settings.defaultModel() != null ? List.of(AIModel.of(settings.defaultModel())) : List.of(),
                httpClient, cache);
    }

    private static BackendSettings normalize(BackendSettings s) {
        var base = s.baseUrl() != null ? s.baseUrl() : DEFAULT_BASE_URL;
        var timeout = s.timeout().compareTo(MIN_TIMEOUT) < 0 ? MIN_TIMEOUT : s.timeout();
        return new BackendSettings(s.name(), base, s.apiKey(), s.defaultModel(), s.models(),
                s.costPer1kTokens(), timeout, s.modelTtl());
    }
}
