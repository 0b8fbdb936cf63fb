package com.llmbridge.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmbridge.errors.BridgeException;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ContentPart;
import com.llmbridge.shared.model.Message;
import org.apache.commons.codec.digest.DigestUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;

/**
 * Deterministic cache key for a request.
 *
 * Covers messages, model, generation parameters and tools. The request id, stream flag and
 * metadata are excluded. Keys are sorted and floats rounded before hashing; text is hashed
 * verbatim.
 */
public class RequestFingerprinter {

    private static final int FLOAT_PRECISION = 2;

    private final ObjectMapper mapper;

    public RequestFingerprinter() {
        this(new ObjectMapper());
    }

    public RequestFingerprinter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String fingerprint(ChatRequest request) {
        try {
            return DigestUtils.sha256Hex(mapper.writeValueAsString(canonicalize(toNode(request))));
        } catch (JsonProcessingException e) {
            throw BridgeException.internal("Cannot fingerprint request " + request.id(), e);
        }
    }

    ObjectNode toNode(ChatRequest request) {
        var root = mapper.createObjectNode();
        root.put("model", request.model());
        var messages = root.putArray("messages");
        for (var m : request.messages()) {
            messages.add(messageNode(m));
        }
        var p = request.params();
        var params = root.putObject("params");
        if (p.temperature() != null) params.put("temperature", p.temperature());
        if (p.maxTokens() != null) params.put("max_tokens", p.maxTokens());
        if (p.topP() != null) params.put("top_p", p.topP());
        if (!p.stopSequences().isEmpty()) {
            var stop = params.putArray("stop");
            p.stopSequences().forEach(stop::add);
        }
        if (p.jsonMode()) params.put("json", true);
        if (request.hasTools()) {
            root.set("tools", mapper.valueToTree(request.tools()));
        }
        return root;
    }

    private ObjectNode messageNode(Message m) {
        var node = mapper.createObjectNode();
        node.put("role", m.role().wireName());
        var parts = node.putArray("content");
        for (var part : m.content()) {
            var pn = parts.addObject();
            if (part.type() == ContentPart.Type.IMAGE) {
                pn.put("image", part.imageUrl());
            } else {
                pn.put("text", part.text());
            }
        }
        if (m.name() != null) node.put("name", m.name());
        if (m.toolCallId() != null) node.put("tool_call_id", m.toolCallId());
        if (m.hasToolCalls()) node.set("tool_calls", mapper.valueToTree(m.toolCalls()));
        return node;
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isObject()) {
            var out = mapper.createObjectNode();
            var names = new ArrayList<String>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            for (var name : names) {
                var value = canonicalize(node.get(name));
                if (value != null) out.set(name, value);
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = mapper.createArrayNode();
            for (var element : node) {
                var value = canonicalize(element);
                if (value != null) out.add(value);
            }
            return out;
        }
        if (node.isFloatingPointNumber()) {
            var rounded = BigDecimal.valueOf(node.asDouble()).setScale(FLOAT_PRECISION, RoundingMode.HALF_UP);
            return mapper.getNodeFactory().numberNode(rounded.doubleValue());
        }
        return node;
    }
}
