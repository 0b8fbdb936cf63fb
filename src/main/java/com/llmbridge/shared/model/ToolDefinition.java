package com.llmbridge.shared.model;

import java.util.Map;

public record ToolDefinition(
    String name,
    String description,
    Map<String, Object> parameters
) {
    public ToolDefinition {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }
}
