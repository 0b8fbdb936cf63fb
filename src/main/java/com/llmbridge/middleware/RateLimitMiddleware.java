package com.llmbridge.middleware;

import com.llmbridge.errors.RateLimitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

public class RateLimitMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(RateLimitMiddleware.class);

    public static final String GLOBAL_KEY = "global";

    private final SlidingWindowRateLimiter limiter;
    private final Function<MiddlewareContext, String> keyFn;

    public RateLimitMiddleware(SlidingWindowRateLimiter limiter) {
        this(limiter, ctx -> ctx.request().metadata().getOrDefault("user", GLOBAL_KEY));
    }

    public RateLimitMiddleware(SlidingWindowRateLimiter limiter, Function<MiddlewareContext, String> keyFn) {
        this.limiter = limiter;
        this.keyFn = keyFn;
    }

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        var key = keyFn.apply(ctx);
        if (!limiter.tryAcquire(key)) {
            log.warn("Rate limit hit for key={} request={}", key, ctx.request().id());
            throw new RateLimitException(key, limiter.maxRequests(), limiter.retryAfter(key));
        }
        return next.proceed(ctx);
    }
}
