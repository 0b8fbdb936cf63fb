package com.llmbridge.shared.model;

public record Capabilities(
    boolean streaming,
    boolean vision,
    boolean tools,
    boolean jsonMode,
    int maxContextTokens
) {
    public static Capabilities textOnly(int maxContextTokens) {
        return new Capabilities(true, false, false, false, maxContextTokens);
    }

    public static Capabilities full(int maxContextTokens) {
        return new Capabilities(true, true, true, true, maxContextTokens);
    }
}
