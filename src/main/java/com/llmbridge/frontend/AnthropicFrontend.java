package com.llmbridge.frontend;

import com.fasterxml.jackson.core.JsonProcessingException;
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AnthropicFrontend implements FrontendAdapter {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public AnthropicFrontend() {
        this(new ObjectMapper());
    }

    public AnthropicFrontend(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "anthropic";
    }

    @Override
    public ChatRequest parse(JsonNode body) {
        if (body == null || !body.isObject()) throw new ValidationException(null, "request body must be a JSON object");
        var messages = new ArrayList<Message>();
        var system = body.get("system");
        if (system != null && !system.isNull()) {
            messages.add(Message.system(system.isTextual() ? system.asText() : joinText(system)));
        }
        var wireMessages = WireFields.requireArray(body, "messages");
        for (int i = 0; i < wireMessages.size(); i++) {
            parseMessage(wireMessages.get(i), "messages[" + i + "]", messages);
        }

        var params = new GenerationParams(
                WireFields.optDouble(body, "temperature"),
                WireFields.optInt(body, "max_tokens"),
                WireFields.optDouble(body, "top_p"),
                WireFields.stringOrArray(body, "stop_sequences"),
                false);

        var tools = new ArrayList<ToolDefinition>();
        for (var t : body.path("tools")) {
            tools.add(new ToolDefinition(t.path("name").asText(null), t.path("description").asText(null),
                    t.has("input_schema") ? mapper.convertValue(t.get("input_schema"), MAP) : Map.of()));
        }

        var metadata = new LinkedHashMap<String, String>();
        var userId = body.path("metadata").path("user_id").asText(null);
        if (userId != null) metadata.put("user", userId);

        return new ChatRequest(null, messages, WireFields.optText(body, "model"), params, tools,
                body.path("stream").asBoolean(false), metadata);
    }

    private void parseMessage(JsonNode node, String field, List<Message> out) {
        var wireRole = node.path("role").asText("");
        Role role = switch (wireRole) {
            case "user" -> Role.USER;
            case "assistant" -> Role.ASSISTANT;
            default -> throw new ValidationException(field + ".role", "must be user or assistant");
        };
        var content = node.get("content");
        if (content != null && content.isTextual()) {
            out.add(Message.text(role, content.asText()));
            return;
        }
        if (content == null || !content.isArray()) {
            throw new ValidationException(field + ".content", "must be a string or an array of blocks");
        }
        var parts = new ArrayList<ContentPart>();
        var toolCalls = new ArrayList<ToolCall>();
        for (var block : content) {
            switch (block.path("type").asText()) {
                case "text" -> parts.add(ContentPart.text(block.path("text").asText("")));
                case "image" -> parts.add(ContentPart.image(imageUrl(block.path("source"))));
                case "tool_use" -> toolCalls.add(new ToolCall(block.path("id").asText(null),
                        block.path("name").asText(null), writeJson(block.path("input"))));
                case "tool_result" -> {
                    var result = block.get("content");
                    var text = result == null ? "" : result.isTextual() ? result.asText() : joinText(result);
                    out.add(new Message(Role.TOOL, List.of(ContentPart.text(text)), null,
                            block.path("tool_use_id").asText(null), List.of()));
                }
                default -> throw new ValidationException(field + ".content",
                        "unsupported block type " + block.path("type").asText());
            }
        }
        if (!parts.isEmpty() || !toolCalls.isEmpty()) {
            out.add(new Message(role, parts, null, null, toolCalls));
        }
    }

    private static String imageUrl(JsonNode source) {
        if ("base64".equals(source.path("type").asText())) {
            return "data:" + source.path("media_type").asText() + ";base64," + source.path("data").asText();
        }
        return source.path("url").asText(null);
    }

    private static String joinText(JsonNode blocks) {
        var sb = new StringBuilder();
        for (var b : blocks) {
            if ("text".equals(b.path("type").asText())) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(b.path("text").asText(""));
            }
        }
        return sb.toString();
    }

    private String writeJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(node.isMissingNode() ? mapper.createObjectNode() : node);
        } catch (JsonProcessingException e) {
            throw new ValidationException("content", "tool_use input is not serializable");
        }
    }

    @Override
    public ObjectNode serialize(ChatResponse response) {
        var root = mapper.createObjectNode();
        root.put("id", "msg_" + response.requestId());
        root.put("type", "message");
        root.put("role", "assistant");
        root.put("model", response.model());
        var content = root.putArray("content");
        if (!response.content().isEmpty()) {
            content.addObject().put("type", "text").put("text", response.content());
        }
        if (response.message() != null) {
            for (var tc : response.message().toolCalls()) {
                var block = content.addObject().put("type", "tool_use").put("id", tc.id()).put("name", tc.name());
                block.set("input", readJson(tc.arguments()));
            }
        }
        root.put("stop_reason", stopReason(response.finishReason()));
        root.putNull("stop_sequence");
        var usage = root.putObject("usage");
        usage.put("input_tokens", response.usage().promptTokens());
        usage.put("output_tokens", response.usage().completionTokens());
        return root;
    }

    private JsonNode readJson(String json) {
        if (json == null || json.isBlank()) return mapper.createObjectNode();
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            // arguments that are not JSON are passed through as a string
            return mapper.getNodeFactory().textNode(json);
        }
    }

    @Override
    public List<ObjectNode> serializeChunk(String requestId, String model, StreamChunk chunk) {
        if (chunk.finishReason() == FinishReason.ERROR) {
            var event = mapper.createObjectNode().put("type", "error");
            var error = event.putObject("error");
            error.put("type", chunk.error() != null ? errorType(chunk.error().kind().name()) : "api_error");
            error.put("message", chunk.error() != null ? chunk.error().message() : "stream failed");
            return List.of(event);
        }
        var events = new ArrayList<ObjectNode>();
        if (chunk.sequence() == 0) {
            var start = mapper.createObjectNode().put("type", "message_start");
            var message = start.putObject("message");
            message.put("id", "msg_" + requestId);
            message.put("type", "message");
            message.put("role", "assistant");
            message.put("model", model);
            message.putArray("content");
            message.putNull("stop_reason");
            message.putObject("usage").put("input_tokens", 0).put("output_tokens", 0);
            events.add(start);
            var blockStart = mapper.createObjectNode().put("type", "content_block_start").put("index", 0);
            blockStart.putObject("content_block").put("type", "text").put("text", "");
            events.add(blockStart);
        }
        if (!chunk.delta().isEmpty()) {
            var delta = mapper.createObjectNode().put("type", "content_block_delta").put("index", 0);
            delta.putObject("delta").put("type", "text_delta").put("text", chunk.delta());
            events.add(delta);
        }
        if (chunk.isTerminal()) {
            events.add(mapper.createObjectNode().put("type", "content_block_stop").put("index", 0));
            var messageDelta = mapper.createObjectNode().put("type", "message_delta");
            messageDelta.putObject("delta").put("stop_reason", stopReason(chunk.finishReason())).putNull("stop_sequence");
            messageDelta.putObject("usage").put("output_tokens",
                    chunk.usage() != null ? chunk.usage().completionTokens() : 0);
            events.add(messageDelta);
            events.add(mapper.createObjectNode().put("type", "message_stop"));
        }
        return events;
    }

    @Override
    public ObjectNode serializeError(BridgeException error) {
        var root = mapper.createObjectNode().put("type", "error");
        var body = root.putObject("error");
        body.put("type", errorType(error.kind().name()));
        body.put("message", error.getMessage());
        return root;
    }

    @Override
    public String sseEventName(ObjectNode event) {
        return event.path("type").asText(null);
    }

    static String stopReason(FinishReason reason) {
        return switch (reason) {
            case STOP, ERROR -> "end_turn";
            case LENGTH -> "max_tokens";
            case TOOL_CALL -> "tool_use";
            case CONTENT_FILTER -> "refusal";
        };
    }

    private static String errorType(String kind) {
        return switch (kind) {
            case "VALIDATION", "NO_CANDIDATE" -> "invalid_request_error";
            case "RATE_LIMIT" -> "rate_limit_error";
            case "TIMEOUT" -> "timeout_error";
            case "BACKEND" -> "overloaded_error";
            default -> "api_error";
        };
    }
}
