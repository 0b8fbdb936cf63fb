package com.llmbridge.middleware;

import com.llmbridge.observability.CostTracker;
import com.llmbridge.providers.ChunkStream;
import com.llmbridge.routing.Selection;
import com.llmbridge.shared.model.ResponseSource;
import com.llmbridge.shared.model.StreamChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CostTrackingMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(CostTrackingMiddleware.class);

    static final int CHARS_PER_TOKEN = 4;

    private final CostTracker tracker;

    public CostTrackingMiddleware(CostTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public MiddlewareContext handle(MiddlewareContext ctx, Next next) {
        var request = ctx.request();
        int estimate = request.totalTextLength() / CHARS_PER_TOKEN;
        ctx.put(StateKeys.COST_ESTIMATE, estimate);
        log.debug("Request {} estimated prompt tokens {}", request.id(), estimate);

        var result = next.proceed(ctx);
        var response = result.response();
        if (response != null && response.source() != ResponseSource.CACHE) {
            tracker.record(request.id(), response.backend(), response.model(), response.usage());
        } else if (result.stream() != null) {
            var selection = result.get(StateKeys.SELECTION, Selection.class).orElse(null);
            result.setStream(new ChargingStream(result.stream(), request.id(), selection));
        }
        return result;
    }

    private class ChargingStream implements ChunkStream {
        private final ChunkStream delegate;
        private final String requestId;
        private final Selection selection;

        ChargingStream(ChunkStream delegate, String requestId, Selection selection) {
            this.delegate = delegate;
            this.requestId = requestId;
            this.selection = selection;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public StreamChunk next() {
            var chunk = delegate.next();
            if (chunk.isTerminal() && chunk.usage() != null) {
                tracker.record(requestId,
                        selection != null ? selection.backend() : null,
                        selection != null ? selection.model() : null,
                        chunk.usage());
            }
            return chunk;
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
