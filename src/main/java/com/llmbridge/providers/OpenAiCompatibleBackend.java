package com.llmbridge.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmbridge.cache.ModelCache;
import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ChatResponse;
import com.llmbridge.shared.model.ContentPart;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.Message;
import com.llmbridge.shared.model.Role;
import com.llmbridge.shared.model.StreamChunk;
import com.llmbridge.shared.model.ToolCall;
import com.llmbridge.shared.model.Usage;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public abstract class OpenAiCompatibleBackend extends AbstractBackendAdapter {

    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    protected OpenAiCompatibleBackend(BackendSettings settings, Capabilities capabilities,
                                      List<AIModel> defaultModels, HttpClient httpClient, ModelCache cache) {
        super(settings, capabilities, true, defaultModels, cache);
        this.httpClient = httpClient != null ? httpClient : defaultClient();
    }

    public static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public ChatResponse call(ChatRequest request) {
        var httpReq = post(buildBody(request, false));
        HttpResponse<String> resp;
        try {
            resp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw HttpErrors.fromIo(name(), e);
        } catch (InterruptedException e) {
            throw HttpErrors.interrupted(name(), e);
        }
        if (resp.statusCode() != 200) {
            throw HttpErrors.fromResponse(name(), resp.statusCode(), resp.headers(), resp.body());
        }
        try {
            return parseResponse(request.id(), mapper.readTree(resp.body()));
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendErrorKind.UNKNOWN, name(), "Unparseable response from " + name(), e);
        }
    }

    @Override
    public ChunkStream stream(ChatRequest request) {
        var httpReq = post(buildBody(request, true));
        HttpResponse<Stream<String>> resp;
        try {
            resp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw HttpErrors.fromIo(name(), e);
        } catch (InterruptedException e) {
            throw HttpErrors.interrupted(name(), e);
        }
        if (resp.statusCode() != 200) {
            String body;
            try (var lines = resp.body()) {
                body = lines.collect(Collectors.joining("\n"));
            }
            throw HttpErrors.fromResponse(name(), resp.statusCode(), resp.headers(), body);
        }
        return new CompletionChunkStream(resp.body());
    }

    @Override
    protected List<AIModel> fetchRemoteModels() throws Exception {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl() + "/models"))
                .timeout(settings.timeout())
                .GET();
        authorize(builder);
        var resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw HttpErrors.fromResponse(name(), resp.statusCode(), resp.headers(), resp.body());
        }
        var models = new ArrayList<AIModel>();
        for (var node : mapper.readTree(resp.body()).path("data")) {
            var id = node.path("id").asText(null);
            if (id != null) models.add(AIModel.of(id));
        }
        return models;
    }

    protected void authorize(HttpRequest.Builder builder) {
        if (settings.apiKey() != null && !settings.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + settings.apiKey());
        }
    }

    private HttpRequest post(ObjectNode body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendErrorKind.INVALID_REQUEST, name(), "Cannot encode request", e);
        }
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(settings.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(json));
        authorize(builder);
        return builder.build();
    }

    ObjectNode buildBody(ChatRequest request, boolean stream) {
        var body = mapper.createObjectNode();
        body.put("model", resolveModel(request));
        var messages = body.putArray("messages");
        for (var m : request.messages()) {
            messages.add(encodeMessage(m));
        }
        var p = request.params();
        if (p.temperature() != null) body.put("temperature", p.temperature());
        if (p.maxTokens() != null) body.put("max_tokens", p.maxTokens());
        if (p.topP() != null) body.put("top_p", p.topP());
        if (!p.stopSequences().isEmpty()) {
            var stop = body.putArray("stop");
            p.stopSequences().forEach(stop::add);
        }
        if (p.jsonMode()) body.putObject("response_format").put("type", "json_object");
        if (request.hasTools()) {
            var tools = body.putArray("tools");
            for (var t : request.tools()) {
                var fn = tools.addObject().put("type", "function").putObject("function");
                fn.put("name", t.name());
                if (t.description() != null) fn.put("description", t.description());
                fn.set("parameters", mapper.valueToTree(t.parameters()));
            }
        }
        if (stream) {
            body.put("stream", true);
            body.putObject("stream_options").put("include_usage", true);
        }
        return body;
    }

    private ObjectNode encodeMessage(Message m) {
        var node = mapper.createObjectNode();
        node.put("role", m.role().wireName());
        if (m.hasImages()) {
            ArrayNode parts = node.putArray("content");
            for (var part : m.content()) {
                if (part.isImage()) {
                    parts.addObject().put("type", "image_url")
                            .putObject("image_url").put("url", part.imageUrl());
                } else {
                    parts.addObject().put("type", "text").put("text", part.text());
                }
            }
        } else {
            node.put("content", m.textContent());
        }
        if (m.name() != null) node.put("name", m.name());
        if (m.role() == Role.TOOL && m.toolCallId() != null) node.put("tool_call_id", m.toolCallId());
        if (m.hasToolCalls()) {
            var calls = node.putArray("tool_calls");
            for (var tc : m.toolCalls()) {
                var call = calls.addObject().put("id", tc.id()).put("type", "function");
                call.putObject("function").put("name", tc.name()).put("arguments", tc.arguments());
            }
        }
        return node;
    }

    private ChatResponse parseResponse(String requestId, JsonNode root) {
        var choice = root.path("choices").path(0);
        var msg = choice.path("message");
        var content = msg.path("content").asText("");
        var toolCalls = new ArrayList<ToolCall>();
        for (var tc : msg.path("tool_calls")) {
            var fn = tc.path("function");
            toolCalls.add(new ToolCall(tc.path("id").asText(), fn.path("name").asText(),
                    fn.path("arguments").asText("")));
        }
        var message = new Message(Role.ASSISTANT, List.of(ContentPart.text(content)), null, null, toolCalls);
        var model = root.path("model").asText(null);
        return new ChatResponse(requestId, message, finishReason(choice.path("finish_reason").asText(null)),
                parseUsage(root.path("usage")), name(), model, Duration.ZERO, null);
    }

    static FinishReason finishReason(String value) {
        if (value == null) return FinishReason.STOP;
        return switch (value) {
            case "length" -> FinishReason.LENGTH;
            case "tool_calls", "function_call" -> FinishReason.TOOL_CALL;
            case "content_filter" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }

    private static Usage parseUsage(JsonNode u) {
        if (u.isMissingNode() || u.isNull()) return Usage.EMPTY;
        return Usage.of(u.path("prompt_tokens").asInt(0), u.path("completion_tokens").asInt(0));
    }

    private class CompletionChunkStream extends SseChunkStream {

        private FinishReason finish;
        private Usage usage;

        CompletionChunkStream(Stream<String> lines) {
            super(lines);
        }

        @Override
        protected boolean onData(String data, Consumer<StreamChunk> emit) throws Exception {
            if ("[DONE]".equals(data)) return false;
            var node = mapper.readTree(data);
            var u = node.path("usage");
            if (u.has("prompt_tokens")) usage = parseUsage(u);
            var choice = node.path("choices").path(0);
            var text = choice.path("delta").path("content").asText(null);
            if (text != null && !text.isEmpty()) emit.accept(StreamChunk.delta(text));
            var reason = choice.path("finish_reason").asText(null);
            if (reason != null) finish = finishReason(reason);
            return true;
        }

        @Override
        protected void onEnd(Consumer<StreamChunk> emit) {
            if (finish != null) emit.accept(StreamChunk.finish(finish, usage));
        }
    }
}
