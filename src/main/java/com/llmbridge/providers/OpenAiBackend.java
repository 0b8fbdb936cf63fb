package com.llmbridge.providers;

import com.llmbridge.cache.ModelCache;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;

import java.net.http.HttpClient;
import java.util.List;

public class OpenAiBackend extends OpenAiCompatibleBackend {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    static final List<AIModel> DEFAULT_MODELS = List.of(
            AIModel.of("gpt-4o", Capabilities.full(128_000)),
            AIModel.of("gpt-4o-mini", Capabilities.full(128_000)),
            AIModel.of("gpt-3.5-turbo", new Capabilities(true, false, true, true, 16_385)));

    public OpenAiBackend(BackendSettings settings, HttpClient httpClient, ModelCache cache) {
        super(normalize(settings), Capabilities.full(128_000), DEFAULT_MODELS, httpClient, cache);
    }

    private static BackendSettings normalize(BackendSettings settings) {
        var s = settings.baseUrl() != null ? settings : settings.withBaseUrl(DEFAULT_BASE_URL);
        return s.defaultModel() != null ? s : s.withDefaultModel("gpt-4o-mini");
    }
}
