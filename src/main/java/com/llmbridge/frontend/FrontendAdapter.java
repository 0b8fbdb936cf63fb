package com.llmbridge.frontend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmbridge.errors.BridgeException;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ChatResponse;
import com.llmbridge.shared.model.StreamChunk;

import java.util.List;

/**
 * A caller-facing wire format. Implementations are pure: the same input always produces the
 * same output and nothing is mutated.
 */
public interface FrontendAdapter {

    String name();

    ChatRequest parse(JsonNode body);

    ObjectNode serialize(ChatResponse response);

    List<ObjectNode> serializeChunk(String requestId, String model, StreamChunk chunk);

    ObjectNode serializeError(BridgeException error);

    default String sseEventName(ObjectNode event) {
        return null;
    }

    default String sseTerminator() {
        return null;
    }

    default int httpStatus(BridgeException error) {
        return switch (error.kind()) {
            case VALIDATION, NO_CANDIDATE -> 400;
            case RATE_LIMIT -> 429;
            case BACKEND, STREAM -> 502;
            case TIMEOUT -> 504;
            case CACHE, INTERNAL -> 500;
        };
    }
}
