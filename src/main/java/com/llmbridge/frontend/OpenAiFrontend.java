package com.llmbridge.frontend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmbridge.errors.BridgeException;
import com.llmbridge.errors.ValidationException;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ChatResponse;
import com.llmbridge.shared.model.ContentPart;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.GenerationParams;
import com.llmbridge.shared.model.Message;
import com.llmbridge.shared.model.Role;
import com.llmbridge.shared.model.StreamChunk;
import com.llmbridge.shared.model.ToolCall;
import com.llmbridge.shared.model.ToolDefinition;
import com.llmbridge.shared.model.Usage;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class OpenAiFrontend implements FrontendAdapter {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Clock clock;

    public OpenAiFrontend() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public OpenAiFrontend(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public ChatRequest parse(JsonNode body) {
        if (body == null || !body.isObject()) throw new ValidationException(null, "request body must be a JSON object");
        var messages = new ArrayList<Message>();
        var wireMessages = WireFields.requireArray(body, "messages");
        for (int i = 0; i < wireMessages.size(); i++) {
            messages.add(parseMessage(wireMessages.get(i), "messages[" + i + "]"));
        }

        var maxTokens = WireFields.optInt(body, "max_completion_tokens");
        if (maxTokens == null) maxTokens = WireFields.optInt(body, "max_tokens");
        var format = body.path("response_format").path("type").asText("");
        var params = new GenerationParams(
                WireFields.optDouble(body, "temperature"),
                maxTokens,
                WireFields.optDouble(body, "top_p"),
                WireFields.stringOrArray(body, "stop"),
                format.equals("json_object") || format.equals("json_schema"));

        var tools = new ArrayList<ToolDefinition>();
        for (var t : body.path("tools")) {
            var fn = t.path("function");
            if (!fn.isObject()) throw new ValidationException("tools", "function definition required");
            tools.add(new ToolDefinition(fn.path("name").asText(null), fn.path("description").asText(null),
                    fn.has("parameters") ? mapper.convertValue(fn.get("parameters"), MAP) : Map.of()));
        }

        var metadata = WireFields.stringMap(body.get("metadata"));
        var user = WireFields.optText(body, "user");
        if (user != null) metadata.put("user", user);

        return new ChatRequest(null, messages, WireFields.optText(body, "model"), params, tools,
                body.path("stream").asBoolean(false), metadata);
    }

    private Message parseMessage(JsonNode node, String field) {
        Role role;
        try {
            role = Role.fromWire(node.path("role").asText(null));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + ".role", e.getMessage());
        }
        var parts = new ArrayList<ContentPart>();
        var content = node.get("content");
        if (content != null && content.isTextual()) {
            parts.add(ContentPart.text(content.asText()));
        } else if (content != null && content.isArray()) {
            for (var part : content) {
                switch (part.path("type").asText()) {
                    case "text" -> parts.add(ContentPart.text(part.path("text").asText("")));
                    case "image_url" -> {
                        var url = part.path("image_url");
                        parts.add(ContentPart.image(url.isTextual() ? url.asText() : url.path("url").asText(null)));
                    }
                    default -> throw new ValidationException(field + ".content",
                            "unsupported part type " + part.path("type").asText());
                }
            }
        } else if (content != null && !content.isNull()) {
            throw new ValidationException(field + ".content", "must be a string or an array");
        }

        var toolCalls = new ArrayList<ToolCall>();
        for (var tc : node.path("tool_calls")) {
            var fn = tc.path("function");
            toolCalls.add(new ToolCall(tc.path("id").asText(null), fn.path("name").asText(null),
                    fn.path("arguments").asText("")));
        }
        return new Message(role, parts, node.path("name").asText(null),
                node.path("tool_call_id").asText(null), toolCalls);
    }

    @Override
    public ObjectNode serialize(ChatResponse response) {
        var root = envelope(response.requestId(), response.model(), "chat.completion");
        var choice = root.putArray("choices").addObject();
        choice.put("index", 0);
        var message = choice.putObject("message");
        message.put("role", "assistant");
        message.put("content", response.content());
        if (response.message() != null && response.message().hasToolCalls()) {
            var calls = message.putArray("tool_calls");
            for (var tc : response.message().toolCalls()) {
                var call = calls.addObject().put("id", tc.id()).put("type", "function");
                call.putObject("function").put("name", tc.name()).put("arguments", tc.arguments());
            }
        }
        choice.put("finish_reason", finishReason(response.finishReason()));
        root.set("usage", usage(response.usage()));
        return root;
    }

    @Override
    public List<ObjectNode> serializeChunk(String requestId, String model, StreamChunk chunk) {
        if (chunk.finishReason() == FinishReason.ERROR) {
            var error = mapper.createObjectNode();
            var body = error.putObject("error");
            body.put("message", chunk.error() != null ? chunk.error().message() : "stream failed");
            body.put("type", chunk.error() != null ? errorType(chunk.error().kind().name()) : "api_error");
            return List.of(error);
        }
        var events = new ArrayList<ObjectNode>();
        if (!chunk.delta().isEmpty() || chunk.sequence() == 0) {
            var event = envelope(requestId, model, "chat.completion.chunk");
            var choice = event.putArray("choices").addObject();
            choice.put("index", 0);
            var delta = choice.putObject("delta");
            if (chunk.sequence() == 0) delta.put("role", "assistant");
            if (!chunk.delta().isEmpty()) delta.put("content", chunk.delta());
            choice.putNull("finish_reason");
            events.add(event);
        }
        if (chunk.isTerminal()) {
            var event = envelope(requestId, model, "chat.completion.chunk");
            var choice = event.putArray("choices").addObject();
            choice.put("index", 0);
            choice.putObject("delta");
            choice.put("finish_reason", finishReason(chunk.finishReason()));
            if (chunk.usage() != null) event.set("usage", usage(chunk.usage()));
            events.add(event);
        }
        return events;
    }

    @Override
    public ObjectNode serializeError(BridgeException error) {
        var root = mapper.createObjectNode();
        var body = root.putObject("error");
        body.put("message", error.getMessage());
        body.put("type", errorType(error.kind().name()));
        body.put("code", error.kind().name().toLowerCase());
        return root;
    }

    @Override
    public String sseTerminator() {
        return "[DONE]";
    }

    static String finishReason(FinishReason reason) {
        return switch (reason) {
            case STOP -> "stop";
            case LENGTH -> "length";
            case TOOL_CALL -> "tool_calls";
            case CONTENT_FILTER -> "content_filter";
            case ERROR -> "error";
        };
    }

    private static String errorType(String kind) {
        return switch (kind) {
            case "VALIDATION", "NO_CANDIDATE" -> "invalid_request_error";
            case "RATE_LIMIT" -> "rate_limit_error";
            case "TIMEOUT" -> "timeout_error";
            default -> "api_error";
        };
    }

    private ObjectNode envelope(String requestId, String model, String object) {
        var root = mapper.createObjectNode();
        root.put("id", "chatcmpl-" + requestId);
        root.put("object", object);
        root.put("created", clock.instant().getEpochSecond());
        root.put("model", model);
        return root;
    }

    private ObjectNode usage(Usage usage) {
        var node = mapper.createObjectNode();
        node.put("prompt_tokens", usage.promptTokens());
        node.put("completion_tokens", usage.completionTokens());
        node.put("total_tokens", usage.totalTokens());
        return node;
    }
}
