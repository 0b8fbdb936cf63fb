package com.llmbridge.middleware;

import com.llmbridge.errors.ValidationException;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.Role;

import java.util.HashSet;

public class ValidationMiddleware implements Middleware {

    private final int maxMessages;
    private final int maxMessageLength;
    private final int maxTokensLimit;

    public ValidationMiddleware() {
        this(100, 100_000, 128_000);
    }

    public ValidationMiddleware(int maxMessages, int maxMessageLength, int maxTokensLimit) {
        this.maxMessages = maxMessages;
        this.maxMessageLength = maxMessageLength;
        this.maxTokensLimit = maxTokensLimit;
    }

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        validate(ctx.request());
        return next.proceed(ctx);
    }

    public void validate(ChatRequest request) {
        var messages = request.messages();
        if (messages.isEmpty()) {
            throw new ValidationException("messages", "must not be empty");
        }
        if (messages.size() > maxMessages) {
            throw new ValidationException("messages", "at most " + maxMessages + " messages allowed");
        }
        for (int i = 0; i < messages.size(); i++) {
            var m = messages.get(i);
            var field = "messages[" + i + "]";
            if (m.role() == null) {
                throw new ValidationException(field + ".role", "is required");
            }
            if (m.content().isEmpty() && !m.hasToolCalls()) {
                throw new ValidationException(field + ".content", "must not be empty");
            }
            if (m.textContent().length() > maxMessageLength) {
                throw new ValidationException(field + ".content", "exceeds " + maxMessageLength + " characters");
            }
            if (m.role() == Role.TOOL && (m.toolCallId() == null || m.toolCallId().isBlank())) {
                throw new ValidationException(field + ".toolCallId", "is required for tool messages");
            }
            for (var part : m.content()) {
                if (part.isImage() && (part.imageUrl() == null || part.imageUrl().isBlank())) {
                    throw new ValidationException(field + ".content", "image part without url");
                }
            }
        }

        var p = request.params();
        if (p.temperature() != null && (p.temperature() < 0 || p.temperature() > 2)) {
            throw new ValidationException("temperature", "must be between 0 and 2");
        }
        if (p.topP() != null && (p.topP() < 0 || p.topP() > 1)) {
            throw new ValidationException("topP", "must be between 0 and 1");
        }
        if (p.maxTokens() != null && (p.maxTokens() < 1 || p.maxTokens() > maxTokensLimit)) {
            throw new ValidationException("maxTokens", "must be between 1 and " + maxTokensLimit);
        }

        var toolNames = new HashSet<String>();
        for (var tool : request.tools()) {
            if (tool.name() == null || tool.name().isBlank()) {
                throw new ValidationException("tools", "tool name is required");
            }
            if (!toolNames.add(tool.name())) {
                throw new ValidationException("tools", "duplicate tool " + tool.name());
            }
        }
    }
}
