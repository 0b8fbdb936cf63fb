package com.llmbridge.middleware;

import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.errors.BridgeException;
import com.llmbridge.errors.NoCandidateException;
import com.llmbridge.routing.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Re-routes an unpinned request to the next-best backend once the layers below give up on a
 * transient backend failure. Sits outside {@link RetryMiddleware} so each backend gets its own
 * retries. When no other backend qualifies the last backend failure is rethrown.
 */
public class FailoverMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(FailoverMiddleware.class);

    static final Set<BackendErrorKind> TRANSIENT = EnumSet.of(
            BackendErrorKind.SERVER, BackendErrorKind.TIMEOUT, BackendErrorKind.QUOTA, BackendErrorKind.UNKNOWN);

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        if (ctx.get(StateKeys.PINNED_BACKEND, String.class).isPresent()) {
            return next.proceed(ctx);
        }
        var rc = ctx.requestContext();
        List<String> failed = new ArrayList<>();
        BackendException last = null;
        Selection lastSelection = null;
        while (true) {
            try {
                return next.proceed(ctx);
            } catch (NoCandidateException e) {
                if (last == null) throw e;
                ctx.put(StateKeys.SELECTION, lastSelection);
                last.addSuppressed(e);
                throw last;
            } catch (BackendException e) {
                var selection = ctx.get(StateKeys.SELECTION, Selection.class).orElse(null);
                if (!TRANSIENT.contains(e.backendKind()) || selection == null) throw e;
                try {
                    rc.checkActive();
                } catch (BridgeException stop) {
                    stop.addSuppressed(e);
                    throw stop;
                }

                failed.add(selection.backend());
                ctx.put(StateKeys.FAILED_OVER, List.copyOf(failed));
                ctx.remove(StateKeys.SELECTION);
                ctx.setResponse(null);
                ctx.setStream(null);
                last = e;
                lastSelection = selection;
                log.warn("Backend {} gave up on request {}: {}; failing over", selection.backend(),
                        rc.requestId(), e.getMessage());
                MDC.put("attempt", String.valueOf(rc.nextAttempt()));
            }
        }
    }
}
