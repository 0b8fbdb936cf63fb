package com.llmbridge.shared.model;

public record ToolCall(String id, String name, String arguments) {}
