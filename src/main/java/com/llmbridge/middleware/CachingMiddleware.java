package com.llmbridge.middleware;

import com.llmbridge.cache.RequestFingerprinter;
import com.llmbridge.cache.ResponseCache;
import com.llmbridge.shared.model.ChatResponse;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.ResponseSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

public class CachingMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(CachingMiddleware.class);

    private final ResponseCache cache;
    private final RequestFingerprinter fingerprinter;
    private final Duration ttl;

    public CachingMiddleware(ResponseCache cache, RequestFingerprinter fingerprinter, Duration ttl) {
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.ttl = ttl;
    }

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        if (ctx.streaming()) return next.proceed(ctx);

        var request = ctx.request();
        var key = fingerprinter.fingerprint(request);
        ctx.put(StateKeys.FINGERPRINT, key);

        var hit = lookup(key);
        if (hit.isPresent()) {
            log.debug("Cache hit for request {}", request.id());
            ctx.put(StateKeys.CACHE_HIT, Boolean.TRUE);
            return ctx.shortCircuit(hit.get()
                    .withRequestId(request.id())
                    .withSource(ResponseSource.CACHE));
        }

        var result = next.proceed(ctx);
        var response = result.response();
        if (response != null && response.source() == ResponseSource.BACKEND
                && response.finishReason() != FinishReason.ERROR) {
            store(key, response);
        }
        return result;
    }

    private Optional<ChatResponse> lookup(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Response cache read failed, treating as miss: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String key, ChatResponse response) {
        try {
            cache.put(key, response, ttl);
        } catch (RuntimeException e) {
            log.warn("Response cache write failed: {}", e.getMessage());
        }
    }
}
