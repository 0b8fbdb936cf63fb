package com.llmbridge.shared.model;

public enum Role {
    SYSTEM, USER, ASSISTANT, TOOL;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Role fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("Missing role");
        return switch (value.toLowerCase()) {
            case "system", "developer" -> SYSTEM;
            case "user" -> USER;
            case "assistant", "model" -> ASSISTANT;
            case "tool", "function" -> TOOL;
            default -> throw new IllegalArgumentException("Unknown role: " + value);
        };
    }
}
