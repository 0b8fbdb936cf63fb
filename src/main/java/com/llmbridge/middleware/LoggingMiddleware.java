package com.llmbridge.middleware;

import com.llmbridge.errors.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class LoggingMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        var request = ctx.request();
        MDC.put("requestId", request.id());
        MDC.put("attempt", String.valueOf(ctx.requestContext().attempt()));
        try {
            log.info("Dispatching request {} messages={} model={} stream={}",
                    request.id(), request.messages().size(), request.model(), ctx.streaming());
            var result = next.proceed(ctx);
            var response = result.response();
            if (response != null) {
                log.info("Request {} completed backend={} model={} finish={} tokens={} source={} attempts={}",
                        request.id(), response.backend(), response.model(), response.finishReason(),
                        response.usage().totalTokens(), response.source(), ctx.requestContext().attempt());
            } else if (result.stream() != null) {
                log.info("Request {} streaming started after {} attempt(s)", request.id(), ctx.requestContext().attempt());
            }
            return result;
        } catch (BridgeException e) {
            log.warn("Request {} failed kind={}: {}", request.id(), e.kind(), e.getMessage());
            throw e;
        } finally {
            MDC.remove("requestId");
            MDC.remove("attempt");
        }
    }
}
