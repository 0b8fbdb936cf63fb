package com.llmbridge.middleware;

import com.llmbridge.bridge.Bridge;
import com.llmbridge.bridge.RequestContext;
import com.llmbridge.cache.InMemoryResponseCache;
import com.llmbridge.cache.RequestFingerprinter;
import com.llmbridge.observability.CostTracker;
import com.llmbridge.providers.BackendRegistry;
import com.llmbridge.providers.MockBackend;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.Message;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CostTrackingMiddlewareTest {

    private final CostTracker tracker = new CostTracker(Map.of("mock", 0.002));

    private Bridge bridge(MockBackend backend, boolean withCache) {
        var pipeline = MiddlewarePipeline.builder();
        if (withCache) {
            pipeline.use(new CachingMiddleware(new InMemoryResponseCache(10), new RequestFingerprinter(),
                    Duration.ofMinutes(1)));
        }
        pipeline.use(new CostTrackingMiddleware(tracker));
        return Bridge.builder(new BackendRegistry().register(backend)).pipeline(pipeline.build()).build();
    }

    private static ChatRequest request() {
        return ChatRequest.of(List.of(Message.user("Summarize the quarterly report")));
    }

    @Test
    void chargesBackendUsage() {
        var backend = MockBackend.builder("mock").build().respondWith("done");
        try (var bridge = bridge(backend, false)) {
            bridge.dispatch(request());
        }

        var summary = tracker.summary();
        assertEquals(1, summary.requests());
        assertEquals(10, summary.promptTokens());
        assertEquals(5, summary.completionTokens());
        assertEquals(15 / 1000.0 * 0.002, summary.totalCost(), 1e-12);
        assertEquals(15 / 1000.0 * 0.002, summary.costByBackend().get("mock"), 1e-12);
    }

    @Test
    void storesPromptEstimate() {
        var request = request();
        var ctx = new MiddlewareContext(request, RequestContext.of(request.id(), Duration.ofSeconds(1)), false);

        new CostTrackingMiddleware(tracker).handle(ctx, c -> c);

        assertEquals(request.totalTextLength() / 4, ctx.get(StateKeys.COST_ESTIMATE, Integer.class).orElseThrow());
        assertEquals(0, tracker.summary().requests());
    }

    @Test
    void cacheHitsAreFree() {
        var backend = MockBackend.builder("mock").build();
        try (var bridge = bridge(backend, true)) {
            bridge.dispatch(request());
            bridge.dispatch(request());
        }

        assertEquals(1, tracker.summary().requests());
    }

    @Test
    void streamIsChargedOnTerminalChunk() {
        var backend = MockBackend.builder("mock").build();
        try (var bridge = bridge(backend, false); var stream = bridge.dispatchStream(request())) {
            assertEquals(0, tracker.summary().requests());
            while (stream.hasNext()) stream.next();
        }

        assertEquals(1, tracker.summary().requests());
        assertTrue(tracker.summary().completionTokens() > 0);
    }
}
