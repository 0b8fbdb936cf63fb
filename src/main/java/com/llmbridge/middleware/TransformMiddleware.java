package com.llmbridge.middleware;

import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ChatResponse;
import com.llmbridge.shared.model.Message;
import com.llmbridge.shared.model.Role;

import java.util.ArrayList;
import java.util.function.UnaryOperator;

public class TransformMiddleware implements Middleware {

    private final UnaryOperator<ChatRequest> requestTransform;
    private final UnaryOperator<ChatResponse> responseTransform;

    public TransformMiddleware(UnaryOperator<ChatRequest> requestTransform,
                               UnaryOperator<ChatResponse> responseTransform) {
        this.requestTransform = requestTransform != null ? requestTransform : UnaryOperator.identity();
        this.responseTransform = responseTransform != null ? responseTransform : UnaryOperator.identity();
    }

    public static TransformMiddleware requests(UnaryOperator<ChatRequest> transform) {
        return new TransformMiddleware(transform, null);
    }

    public static TransformMiddleware responses(UnaryOperator<ChatResponse> transform) {
        return new TransformMiddleware(null, transform);
    }

    public static TransformMiddleware systemPrompt(String prompt) {
        return requests(request -> {
            if (request.messages().stream().anyMatch(m -> m.role() == Role.SYSTEM)) return request;
            var messages = new ArrayList<Message>();
            messages.add(Message.system(prompt));
            messages.addAll(request.messages());
            return request.withMessages(messages);
        });
    }

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        ctx.setRequest(requestTransform.apply(ctx.request()));
        var result = next.proceed(ctx);
        if (result.response() != null) {
            result.setResponse(responseTransform.apply(result.response()));
        }
        return result;
    }
}
