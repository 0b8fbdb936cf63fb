package com.llmbridge.frontend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmbridge.bridge.Bridge;
import com.llmbridge.bridge.BridgeStream;
import com.llmbridge.bridge.DispatchOptions;
import com.llmbridge.errors.BridgeException;
import com.llmbridge.errors.ValidationException;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;

public class FrontendBridge {

    private final Bridge bridge;
    private final FrontendAdapter frontend;
    private final ObjectMapper mapper;

    public FrontendBridge(Bridge bridge, FrontendAdapter frontend) {
        this(bridge, frontend, new ObjectMapper());
    }

    public FrontendBridge(Bridge bridge, FrontendAdapter frontend, ObjectMapper mapper) {
        this.bridge = bridge;
        this.frontend = frontend;
        this.mapper = mapper;
    }

    public FrontendAdapter frontend() {
        return frontend;
    }

    public ObjectNode chat(JsonNode body, DispatchOptions options) {
        var request = frontend.parse(body).withStream(false);
        return frontend.serialize(bridge.dispatch(request, options));
    }

    public ObjectNode chat(String json, DispatchOptions options) {
        return chat(readBody(json), options);
    }

    public ObjectNode error(BridgeException error) {
        return frontend.serializeError(error);
    }

    public EventIterator chatStream(JsonNode body, DispatchOptions options) {
        var request = frontend.parse(body);
        return new EventIterator(bridge.dispatchStream(request, options));
    }

    public void streamSse(JsonNode body, DispatchOptions options, Writer out) throws IOException {
        try (var events = chatStream(body, options)) {
            while (events.hasNext()) {
                var event = events.next();
                var name = frontend.sseEventName(event);
                if (name != null) out.write("event: " + name + "\n");
                out.write("data: " + mapper.writeValueAsString(event) + "\n\n");
                out.flush();
            }
            var terminator = frontend.sseTerminator();
            if (terminator != null) {
                out.write("data: " + terminator + "\n\n");
                out.flush();
            }
        }
    }

    private JsonNode readBody(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException(null, "request body is not valid JSON");
        }
    }

    public class EventIterator implements Iterator<ObjectNode>, AutoCloseable {
        private final BridgeStream stream;
        private final ArrayDeque<ObjectNode> pending = new ArrayDeque<>();

        EventIterator(BridgeStream stream) {
            this.stream = stream;
        }

        public String requestId() {
            return stream.requestId();
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && stream.hasNext()) {
                var chunk = stream.next();
                pending.addAll(frontend.serializeChunk(stream.requestId(), stream.model(), chunk));
            }
            return !pending.isEmpty();
        }

        @Override
        public ObjectNode next() {
            if (!hasNext()) throw new NoSuchElementException();
            return pending.poll();
        }

        @Override
        public void close() {
            stream.close();
        }
    }
}
