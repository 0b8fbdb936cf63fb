package com.llmbridge.shared.model;

public record AIModel(
    String id,
    String name,
    Capabilities capabilities
) {
    public static AIModel of(String id) {
        return new AIModel(id, id, null);
    }

    public static AIModel of(String id, Capabilities capabilities) {
        return new AIModel(id, id, capabilities);
    }

    public Capabilities effectiveCapabilities(Capabilities adapterDefaults) {
        return capabilities != null ? capabilities : adapterDefaults;
    }
}
