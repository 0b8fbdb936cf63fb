package com.llmbridge.middleware;

import com.llmbridge.errors.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Re-runs everything below it on transient failures. Attempts are numbered on the shared
 * {@link com.llmbridge.bridge.RequestContext} but counted against the limit from the attempt
 * this layer was entered on, so a failed-over request starts with a fresh allowance.
 */
public class RetryMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    private final RetryPolicy policy;
    private final DoubleSupplier random;

    public RetryMiddleware(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryMiddleware(RetryPolicy policy, DoubleSupplier random) {
        this.policy = policy;
        this.random = random;
    }

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        var rc = ctx.requestContext();
        int first = rc.attempt();
        while (true) {
            try {
                var result = next.proceed(ctx);
                if (rc.attempt() > first) {
                    ctx.put(StateKeys.RETRIES, rc.attempt() - first);
                    log.info("Request {} recovered on attempt {}", rc.requestId(), rc.attempt());
                }
                return result;
            } catch (BridgeException e) {
                int attempt = rc.attempt() - first + 1;
                if (!policy.shouldRetry(e) || attempt >= policy.maxAttempts()) throw e;

                var delay = policy.delayFor(attempt, e, random);
                log.warn("Attempt {}/{} for request {} failed: {}; retrying in {}ms",
                        attempt, policy.maxAttempts(), rc.requestId(), e.getMessage(), delay.toMillis());
                ctx.setResponse(null);
                ctx.setStream(null);
                try {
                    rc.sleep(delay);
                } catch (BridgeException stop) {
                    stop.addSuppressed(e);
                    throw stop;
                }
                MDC.put("attempt", String.valueOf(rc.nextAttempt()));
            }
        }
    }
}
