package com.llmbridge.shared.model;

import java.util.List;
import java.util.stream.Collectors;

public record Message(
    Role role,
    List<ContentPart> content,
    String name,
    String toolCallId,
    List<ToolCall> toolCalls
) {
    public Message {
        content = content != null ? List.copyOf(content) : List.of();
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public Message(Role role, List<ContentPart> content) {
        this(role, content, null, null, List.of());
    }

    public static Message text(Role role, String text) {
        return new Message(role, List.of(ContentPart.text(text)));
    }

    public static Message system(String text) { return text(Role.SYSTEM, text); }

    public static Message user(String text) { return text(Role.USER, text); }

    public static Message assistant(String text) { return text(Role.ASSISTANT, text); }

    public String textContent() {
        return content.stream()
                .filter(p -> p.type() == ContentPart.Type.TEXT && p.text() != null)
                .map(ContentPart::text)
                .collect(Collectors.joining());
    }

    public boolean hasImages() {
        return content.stream().anyMatch(ContentPart::isImage);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
