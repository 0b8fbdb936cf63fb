package com.llmbridge.providers;

import com.llmbridge.routing.CapabilityFilter;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;
import com.llmbridge.shared.model.ModelSource;

import java.time.Instant;
import java.util.List;

public record ListModelsResult(
    List<AIModel> models,
    ModelSource source,
    Instant fetchedAt,
    boolean complete
) {
    public ListModelsResult {
        models = models != null ? List.copyOf(models) : List.of();
    }

    public ListModelsResult filter(CapabilityFilter filter, Capabilities adapterDefaults) {
        if (filter == null || filter.isEmpty()) return this;
        var kept = models.stream()
                .filter(m -> filter.test(m.effectiveCapabilities(adapterDefaults)))
                .toList();
        return new ListModelsResult(kept, source, fetchedAt, complete);
    }

    public boolean contains(String modelId) {
        return models.stream().anyMatch(m -> m.id().equals(modelId));
    }
}
