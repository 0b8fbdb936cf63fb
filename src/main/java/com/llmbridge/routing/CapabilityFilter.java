package com.llmbridge.routing;

import com.llmbridge.shared.model.Capabilities;
import com.llmbridge.shared.model.ChatRequest;

import java.util.ArrayList;

public record CapabilityFilter(
    boolean streaming,
    boolean vision,
    boolean tools,
    boolean jsonMode,
    int minContextTokens
) {
    public static final CapabilityFilter NONE = new CapabilityFilter(false, false, false, false, 0);

    public static CapabilityFilter requireVision() {
        return new CapabilityFilter(false, true, false, false, 0);
    }

    public static CapabilityFilter requireTools() {
        return new CapabilityFilter(false, false, true, false, 0);
    }

    public static CapabilityFilter inferFrom(ChatRequest request) {
        return new CapabilityFilter(
                request.stream(),
                request.hasImages(),
                request.hasTools(),
                request.params().jsonMode(),
                0);
    }

    public boolean test(Capabilities caps) {
        if (caps == null) return isEmpty();
        if (streaming && !caps.streaming()) return false;
        if (vision && !caps.vision()) return false;
        if (tools && !caps.tools()) return false;
        if (jsonMode && !caps.jsonMode()) return false;
        return minContextTokens <= 0 || caps.maxContextTokens() >= minContextTokens;
    }

    public CapabilityFilter merge(CapabilityFilter other) {
        if (other == null) return this;
        return new CapabilityFilter(
                streaming || other.streaming,
                vision || other.vision,
                tools || other.tools,
                jsonMode || other.jsonMode,
                Math.max(minContextTokens, other.minContextTokens));
    }

    public boolean isEmpty() {
        return !streaming && !vision && !tools && !jsonMode && minContextTokens <= 0;
    }

    public String describe() {
        var parts = new ArrayList<String>();
        if (streaming) parts.add("streaming");
        if (vision) parts.add("vision");
        if (tools) parts.add("tools");
        if (jsonMode) parts.add("json");
        if (minContextTokens > 0) parts.add("context>=" + minContextTokens);
        return parts.isEmpty() ? "none" : String.join(",", parts);
    }
}
