package com.llmbridge.providers;

import com.llmbridge.cache.CatalogResolver;
import com.llmbridge.cache.ModelCache;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;
import com.llmbridge.shared.model.ChatRequest;

import java.time.Clock;
import java.util.List;

public abstract class AbstractBackendAdapter implements BackendAdapter {

    protected final BackendSettings settings;
    private final AdapterMetadata metadata;
    private final CatalogResolver catalog;

    protected AbstractBackendAdapter(BackendSettings settings, Capabilities capabilities,
                                     boolean remoteModelListing, List<AIModel> defaultModels,
                                     ModelCache cache) {
        this.settings = settings;
        this.metadata = new AdapterMetadata(settings.name(), capabilities, remoteModelListing,
                settings.defaultModel(), settings.costPer1kTokens());
        var override = settings.models().stream().map(AIModel::of).toList();
        this.catalog = new CatalogResolver(settings.name(), cache, override, defaultModels,
                settings.modelTtl(), Clock.systemUTC());
    }

    @Override
    public AdapterMetadata metadata() {
        return metadata;
    }

    @Override
    public ListModelsResult listModels(ListModelsOptions options) {
        CatalogResolver.RemoteFetcher fetcher = metadata.remoteModelListing() ? this::fetchRemoteModels : null;
        return catalog.resolve(options, fetcher, metadata.capabilities());
    }

    protected List<AIModel> fetchRemoteModels() throws Exception {
        throw new UnsupportedOperationException(name() + " has no model listing endpoint");
    }

    protected String resolveModel(ChatRequest request) {
        return request.model() != null ? request.model() : settings.defaultModel();
    }
}
