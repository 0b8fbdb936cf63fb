package com.llmbridge.middleware;

import com.llmbridge.errors.ValidationException;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ContentPart;
import com.llmbridge.shared.model.Message;
import com.llmbridge.shared.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public class SecurityMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(SecurityMiddleware.class);

    static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("ignore\\s+(previous|above|all)\\s+(instructions|prompts?|commands?)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("system\\s*:\\s*new\\s+(instruction|prompt|role)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(jailbreak|DAN|developer\\s+mode)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(you\\s+are\\s+now|act\\s+as\\s+if\\s+you\\s+are)\\s+a\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard\\s+(all|any|previous|above)", Pattern.CASE_INSENSITIVE));

    // order matters: card numbers would otherwise be half-eaten by the phone pattern
    static final Map<String, Pattern> PII_PATTERNS = new LinkedHashMap<>();
    static {
        PII_PATTERNS.put("EMAIL", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"));
        PII_PATTERNS.put("SSN", Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"));
        PII_PATTERNS.put("CREDITCARD", Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b"));
        PII_PATTERNS.put("PHONE", Pattern.compile("\\b(\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b"));
        PII_PATTERNS.put("IPADDRESS", Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b"));
        PII_PATTERNS.put("APIKEY", Pattern.compile("\\b[A-Za-z0-9]{32,}\\b"));
    }

    private final boolean blockInjection;
    private final boolean redactPii;

    public SecurityMiddleware(boolean blockInjection, boolean redactPii) {
        this.blockInjection = blockInjection;
        this.redactPii = redactPii;
    }

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        var request = ctx.request();
        if (blockInjection) {
            for (var m : request.messages()) {
                if (m.role() == Role.USER && looksLikeInjection(m.textContent())) {
                    log.warn("Rejected request {}: possible prompt injection", request.id());
                    throw new ValidationException("messages", "possible prompt injection detected");
                }
            }
        }
        if (redactPii) {
            ctx.setRequest(redact(request));
        }
        return next.proceed(ctx);
    }

    static boolean looksLikeInjection(String text) {
        return INJECTION_PATTERNS.stream().anyMatch(p -> p.matcher(text).find());
    }

    static String redact(String text) {
        var out = text;
        for (var e : PII_PATTERNS.entrySet()) {
            out = e.getValue().matcher(out).replaceAll("[REDACTED_" + e.getKey() + "]");
        }
        return out;
    }

    private static ChatRequest redact(ChatRequest request) {
        var messages = request.messages().stream().map(m -> {
            if (m.role() != Role.USER) return m;
            var parts = m.content().stream()
                    .map(p -> p.isImage() || p.text() == null ? p : ContentPart.text(redact(p.text())))
                    .toList();
            return new Message(m.role(), parts, m.name(), m.toolCallId(), m.toolCalls());
        }).toList();
        return request.withMessages(messages);
    }
}
