package com.llmbridge.routing;

import com.llmbridge.providers.AdapterMetadata;
import com.llmbridge.shared.model.AIModel;

import java.util.List;

public record Candidate(AdapterMetadata metadata, List<AIModel> models) {
    public Candidate {
        models = models != null ? List.copyOf(models) : List.of();
    }

    public String name() {
        return metadata.name();
    }
}
