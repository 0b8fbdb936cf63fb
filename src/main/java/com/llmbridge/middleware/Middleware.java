package com.llmbridge.middleware;

/**
 * One layer around the backend call. Work before {@code next.proceed(ctx)} is the pre-phase,
 * work after it the post-phase. Returning without calling {@code next} short-circuits every
 * later layer and the backend.
 */
@FunctionalInterface
public interface Middleware {

    MiddlewareContext handle(MiddlewareContext ctx, Next next);

    default String name() {
        return getClass().getSimpleName();
    }

    @FunctionalInterface
    interface Next {
        MiddlewareContext proceed(MiddlewareContext ctx);
    }
}
