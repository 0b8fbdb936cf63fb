package com.llmbridge.providers;

import com.llmbridge.cache.ModelCache;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;

import java.net.http.HttpClient;
import java.util.List;

public class DeepSeekBackend extends OpenAiCompatibleBackend {

    public static final String DEFAULT_BASE_URL = "https://api.deepseek.com/v1";

    private static final Capabilities CAPABILITIES = new Capabilities(true, false, true, true, 64_000);

    static final List<AIModel> DEFAULT_MODELS = List.of(
            AIModel.of("deepseek-chat", CAPABILITIES),
            AIModel.of("deepseek-reasoner", new Capabilities(true, false, false, false, 64_000)));

    public DeepSeekBackend(BackendSettings settings, HttpClient httpClient, ModelCache cache) {
        super(normalize(settings), CAPABILITIES, DEFAULT_MODELS, httpClient, cache);
    }

    private static BackendSettings normalize(BackendSettings settings) {
        var s = settings.baseUrl() != null ? settings : settings.withBaseUrl(DEFAULT_BASE_URL);
        return s.defaultModel() != null ? s : s.withDefaultModel("deepseek-chat");
    }
}
