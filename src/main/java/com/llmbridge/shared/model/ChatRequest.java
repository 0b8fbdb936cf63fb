package com.llmbridge.shared.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ChatRequest(
    String id,
    List<Message> messages,
    String model,
    GenerationParams params,
    List<ToolDefinition> tools,
    boolean stream,
    Map<String, String> metadata
) {
    public ChatRequest {
        if (id == null || id.isBlank()) id = newId();
        messages = messages != null ? List.copyOf(messages) : List.of();
        params = params != null ? params : GenerationParams.defaults();
        tools = tools != null ? List.copyOf(tools) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static ChatRequest of(List<Message> messages) {
        return new ChatRequest(null, messages, null, null, null, false, null);
    }

    public static ChatRequest of(String model, List<Message> messages) {
        return new ChatRequest(null, messages, model, null, null, false, null);
    }

    public static String newId() {
        return "req-" + UUID.randomUUID();
    }

    public ChatRequest withModel(String model) {
        return new ChatRequest(id, messages, model, params, tools, stream, metadata);
    }

    public ChatRequest withStream(boolean stream) {
        return new ChatRequest(id, messages, model, params, tools, stream, metadata);
    }

    public ChatRequest withMessages(List<Message> messages) {
        return new ChatRequest(id, messages, model, params, tools, stream, metadata);
    }

    public ChatRequest withParams(GenerationParams params) {
        return new ChatRequest(id, messages, model, params, tools, stream, metadata);
    }

    public ChatRequest withTools(List<ToolDefinition> tools) {
        return new ChatRequest(id, messages, model, params, tools, stream, metadata);
    }

    public ChatRequest withMetadata(Map<String, String> metadata) {
        return new ChatRequest(id, messages, model, params, tools, stream, metadata);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    public boolean hasImages() {
        return messages.stream().anyMatch(Message::hasImages);
    }

    public int totalTextLength() {
        return messages.stream().mapToInt(m -> m.textContent().length()).sum();
    }
}
