package com.llmbridge.providers;

import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ChatResponse;

/**
 * One concrete provider. Implementations translate IR to the provider wire format and back and
 * classify provider failures as {@link com.llmbridge.errors.BackendException}. The Bridge never
 * branches on which implementation it holds.
 */
public interface BackendAdapter {

    AdapterMetadata metadata();

    ChatResponse call(ChatRequest request);

    ChunkStream stream(ChatRequest request);

    /** Must not throw: every failure resolves to a fallback catalog. */
    ListModelsResult listModels(ListModelsOptions options);

    default String name() {
        return metadata().name();
    }
}
