package com.llmbridge.middleware;

import com.llmbridge.bridge.RequestContext;
import com.llmbridge.providers.ChunkStream;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ChatResponse;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class MiddlewareContext {

    private final RequestContext requestContext;
    private final boolean streaming;
    private final Map<String, Object> state = new HashMap<>();
    private ChatRequest request;
    private ChatResponse response;
    private ChunkStream stream;

    public MiddlewareContext(ChatRequest request, RequestContext requestContext, boolean streaming) {
        this.request = request;
        this.requestContext = requestContext;
        this.streaming = streaming;
    }

    public ChatRequest request() { return request; }

    public void setRequest(ChatRequest request) { this.request = request; }

    public RequestContext requestContext() { return requestContext; }

    public boolean streaming() { return streaming; }

    public ChatResponse response() { return response; }

    public void setResponse(ChatResponse response) { this.response = response; }

    public ChunkStream stream() { return stream; }

    public void setStream(ChunkStream stream) { this.stream = stream; }

    public boolean hasResult() {
        return streaming ? stream != null : response != null;
    }

    public MiddlewareContext shortCircuit(ChatResponse response) {
        this.response = response;
        return this;
    }

    public void put(String key, Object value) {
        state.put(key, value);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        var value = state.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public void remove(String key) {
        state.remove(key);
    }
}
