package com.llmbridge.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmbridge.cache.ModelCache;
import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.errors.StreamException;
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

public class AnthropicBackend extends AbstractBackendAdapter {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String API_VERSION = "2023-06-01";
    static final int DEFAULT_MAX_TOKENS = 4096;

    private static final Capabilities CAPABILITIES = Capabilities.full(200_000);

    static final List<AIModel> DEFAULT_MODELS = List.of(
            AIModel.of("claude-3-5-sonnet-20241022", CAPABILITIES),
            AIModel.of("claude-3-5-haiku-20241022", new Capabilities(true, false, true, true, 200_000)),
            AIModel.of("claude-3-opus-20240229", CAPABILITIES),
            AIModel.of("claude-3-haiku-20240307", CAPABILITIES));

    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public AnthropicBackend(BackendSettings settings, HttpClient httpClient, ModelCache cache) {
        super(normalize(settings), CAPABILITIES, false, DEFAULT_MODELS, cache);
        this.httpClient = httpClient != null ? httpClient : OpenAiCompatibleBackend.defaultClient();
    }

    private static BackendSettings normalize(BackendSettings settings) {
        var s = settings.baseUrl() != null ? settings : settings.withBaseUrl(DEFAULT_BASE_URL);
        return s.defaultModel() != null ? s : s.withDefaultModel("claude-3-5-sonnet-20241022");
    }

    @Override
    public ChatResponse call(ChatRequest request) {
        HttpResponse<String> resp;
        try {
            resp = httpClient.send(post(buildBody(request, false)), HttpResponse.BodyHandlers.ofString());
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
        HttpResponse<Stream<String>> resp;
        try {
            resp = httpClient.send(post(buildBody(request, true)), HttpResponse.BodyHandlers.ofLines());
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
        return new MessageChunkStream(resp.body());
    }

    private HttpRequest post(ObjectNode body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendErrorKind.INVALID_REQUEST, name(), "Cannot encode request", e);
        }
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl() + "/v1/messages"))
                .header("Content-Type", "application/json")
                .header("anthropic-version", API_VERSION)
                .timeout(settings.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(json));
        if (settings.apiKey() != null) builder.header("x-api-key", settings.apiKey());
        return builder.build();
    }

    ObjectNode buildBody(ChatRequest request, boolean stream) {
        var body = mapper.createObjectNode();
        body.put("model", resolveModel(request));
        var p = request.params();
        body.put("max_tokens", p.maxTokens() != null ? p.maxTokens() : DEFAULT_MAX_TOKENS);

        var system = request.messages().stream()
                .filter(m -> m.role() == Role.SYSTEM)
                .map(Message::textContent)
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) body.put("system", system);

        var messages = body.putArray("messages");
        for (var m : request.messages()) {
            if (m.role() == Role.SYSTEM) continue;
            messages.add(encodeMessage(m));
        }
        if (p.temperature() != null) body.put("temperature", p.temperature());
        if (p.topP() != null) body.put("top_p", p.topP());
        if (!p.stopSequences().isEmpty()) {
            var stop = body.putArray("stop_sequences");
            p.stopSequences().forEach(stop::add);
        }
        if (request.hasTools()) {
            var tools = body.putArray("tools");
            for (var t : request.tools()) {
                var tool = tools.addObject().put("name", t.name());
                if (t.description() != null) tool.put("description", t.description());
                tool.set("input_schema", mapper.valueToTree(t.parameters()));
            }
        }
        if (stream) body.put("stream", true);
        return body;
    }

    private ObjectNode encodeMessage(Message m) {
        var node = mapper.createObjectNode();
        var blocks = mapper.createArrayNode();
        if (m.role() == Role.TOOL) {
            node.put("role", "user");
            blocks.addObject()
                    .put("type", "tool_result")
                    .put("tool_use_id", m.toolCallId())
                    .put("content", m.textContent());
        } else {
            node.put("role", m.role() == Role.ASSISTANT ? "assistant" : "user");
            for (var part : m.content()) {
                if (part.isImage()) {
                    blocks.add(imageBlock(part.imageUrl()));
                } else if (part.text() != null && !part.text().isEmpty()) {
                    blocks.addObject().put("type", "text").put("text", part.text());
                }
            }
            for (var tc : m.toolCalls()) {
                var use = blocks.addObject().put("type", "tool_use").put("id", tc.id()).put("name", tc.name());
                use.set("input", parseArguments(tc.arguments()));
            }
        }
        node.set("content", blocks);
        return node;
    }

    private ObjectNode imageBlock(String url) {
        var block = mapper.createObjectNode().put("type", "image");
        var source = block.putObject("source");
        if (url.startsWith("data:") && url.contains(";base64,")) {
            var comma = url.indexOf(',');
            source.put("type", "base64")
                    .put("media_type", url.substring(5, url.indexOf(';')))
                    .put("data", url.substring(comma + 1));
        } else {
            source.put("type", "url").put("url", url);
        }
        return block;
    }

    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) return mapper.createObjectNode();
        try {
            return mapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendErrorKind.INVALID_REQUEST, name(),
                    "Tool call arguments are not valid JSON", e);
        }
    }

    private ChatResponse parseResponse(String requestId, JsonNode root) throws JsonProcessingException {
        var text = new StringBuilder();
        var toolCalls = new ArrayList<ToolCall>();
        for (var block : root.path("content")) {
            switch (block.path("type").asText()) {
                case "text" -> text.append(block.path("text").asText(""));
                case "tool_use" -> toolCalls.add(new ToolCall(block.path("id").asText(),
                        block.path("name").asText(), mapper.writeValueAsString(block.path("input"))));
                default -> { }
            }
        }
        var message = new Message(Role.ASSISTANT, List.of(ContentPart.text(text.toString())), null, null, toolCalls);
        var u = root.path("usage");
        var usage = Usage.of(u.path("input_tokens").asInt(0), u.path("output_tokens").asInt(0));
        return new ChatResponse(requestId, message, stopReason(root.path("stop_reason").asText(null)), usage,
                name(), root.path("model").asText(null), Duration.ZERO, null);
    }

    static FinishReason stopReason(String value) {
        if (value == null) return FinishReason.STOP;
        return switch (value) {
            case "max_tokens" -> FinishReason.LENGTH;
            case "tool_use" -> FinishReason.TOOL_CALL;
            case "refusal" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }

    private class MessageChunkStream extends SseChunkStream {

        private int inputTokens;
        private int outputTokens;
        private FinishReason finish;

        MessageChunkStream(Stream<String> lines) {
            super(lines);
        }

        @Override
        protected boolean onData(String data, Consumer<StreamChunk> emit) throws Exception {
            var node = mapper.readTree(data);
            switch (node.path("type").asText()) {
                case "message_start" ->
                        inputTokens = node.path("message").path("usage").path("input_tokens").asInt(0);
                case "content_block_delta" -> {
                    var text = node.path("delta").path("text").asText(null);
                    if (text != null && !text.isEmpty()) emit.accept(StreamChunk.delta(text));
                }
                case "message_delta" -> {
                    var reason = node.path("delta").path("stop_reason").asText(null);
                    if (reason != null) finish = stopReason(reason);
                    outputTokens = node.path("usage").path("output_tokens").asInt(outputTokens);
                }
                case "message_stop" -> {
                    return false;
                }
                case "error" -> throw new StreamException(
                        name() + " stream error: " + node.path("error").path("message").asText("unknown"), null);
                default -> { }
            }
            return true;
        }

        @Override
        protected void onEnd(Consumer<StreamChunk> emit) {
            if (finish != null) emit.accept(StreamChunk.finish(finish, Usage.of(inputTokens, outputTokens)));
        }
    }
}
