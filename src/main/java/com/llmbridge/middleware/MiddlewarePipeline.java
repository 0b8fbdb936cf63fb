package com.llmbridge.middleware;

import com.llmbridge.errors.BridgeException;

import java.util.ArrayList;
import java.util.List;

public final class MiddlewarePipeline {

    private final List<Middleware> middlewares;

    private MiddlewarePipeline(List<Middleware> middlewares) {
        this.middlewares = List.copyOf(middlewares);
    }

    public static MiddlewarePipeline empty() {
        return new MiddlewarePipeline(List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Middleware> middlewares() {
        return middlewares;
    }

    public MiddlewareContext execute(MiddlewareContext ctx, Middleware.Next terminal) {
        Middleware.Next chain = terminal;
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            var middleware = middlewares.get(i);
            var downstream = chain;
            chain = c -> invoke(middleware, c, downstream);
        }
        return chain.proceed(ctx);
    }

    private static MiddlewareContext invoke(Middleware middleware, MiddlewareContext ctx, Middleware.Next next) {
        try {
            return middleware.handle(ctx, next);
        } catch (BridgeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw BridgeException.internal("Middleware " + middleware.name() + " failed: " + e.getMessage(), e);
        }
    }

    public static class Builder {
        private final List<Middleware> middlewares = new ArrayList<>();

        public Builder use(Middleware middleware) {
            middlewares.add(middleware);
            return this;
        }

        public MiddlewarePipeline build() {
            return new MiddlewarePipeline(middlewares);
        }
    }
}
