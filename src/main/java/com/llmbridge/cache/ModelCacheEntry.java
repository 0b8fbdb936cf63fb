package com.llmbridge.cache;

import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.ModelSource;

import java.time.Instant;
import java.util.List;

public record ModelCacheEntry(
    List<AIModel> models,
    ModelSource source,
    Instant fetchedAt,
    boolean complete
) {
    public ModelCacheEntry {
        models = models != null ? List.copyOf(models) : List.of();
    }

    public ModelCacheEntry asStale() {
        return new ModelCacheEntry(models, ModelSource.STALE, fetchedAt, complete);
    }
}
