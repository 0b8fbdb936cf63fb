package com.llmbridge.middleware;

import com.llmbridge.bridge.Bridge;
import com.llmbridge.bridge.DispatchOutcome;
import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.errors.DeadlineExceededException;
import com.llmbridge.observability.BridgeEvent;
import com.llmbridge.observability.EventDispatcher;
import com.llmbridge.providers.BackendRegistry;
import com.llmbridge.providers.MockBackend;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RetryMiddlewareTest {

    private MockBackend backend;
    private Bridge bridge;
    private final List<BridgeEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        backend = MockBackend.builder("mock").build();
        var dispatcher = EventDispatcher.direct();
        dispatcher.addListener(events::add);
        var policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 2.0, 1.0, 1.0);
        bridge = Bridge.builder(new BackendRegistry().register(backend))
                .pipeline(MiddlewarePipeline.builder().use(new RetryMiddleware(policy)).build())
                .events(dispatcher)
                .build();
    }

    @AfterEach
    void tearDown() {
        bridge.close();
    }

    private static ChatRequest hello() {
        return ChatRequest.of(List.of(Message.user("hello")));
    }

    @Test
    void recoversFromTransientFailures() {
        backend.failWith(new BackendException(BackendErrorKind.SERVER, "mock", 503, "unavailable", null, null))
                .failWith(new BackendException(BackendErrorKind.SERVER, "mock", 502, "bad gateway", null, null))
                .respondWith("finally");

        var response = bridge.dispatch(hello());

        assertEquals("finally", response.content());
        assertEquals(3, backend.callCount());
        var end = events.get(events.size() - 1);
        assertEquals(BridgeEvent.Type.REQUEST_END, end.type());
        assertEquals(3, end.attempts());
        assertEquals(DispatchOutcome.RETRIED_SUCCESS, end.outcome());
    }

    @Test
    void permanentFailureIsNotRetried() {
        backend.failWith(new BackendException(BackendErrorKind.AUTH, "mock", 401, "bad key", null, null));

        var ex = assertThrows(BackendException.class, () -> bridge.dispatch(hello()));

        assertEquals(BackendErrorKind.AUTH, ex.backendKind());
        assertEquals(1, backend.callCount());
        var last = events.get(events.size() - 1);
        assertEquals(BridgeEvent.Type.REQUEST_ERROR, last.type());
        assertEquals(DispatchOutcome.FAILED, last.outcome());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        for (int i = 0; i < 5; i++) {
            backend.failWith(new BackendException(BackendErrorKind.SERVER, "mock", 500, "boom " + i, null, null));
        }

        var ex = assertThrows(BackendException.class, () -> bridge.dispatch(hello()));

        assertEquals("boom 2", ex.getMessage());
        assertEquals(3, backend.callCount());
    }

    @Test
    void deadlineStopsRetrying() {
        var slowPolicy = new RetryPolicy(5, Duration.ofSeconds(5), Duration.ofSeconds(5), 1.0, 1.0, 1.0);
        try (var shortBridge = Bridge.builder(new BackendRegistry().register(backend))
                .pipeline(MiddlewarePipeline.builder().use(new RetryMiddleware(slowPolicy)).build())
                .defaultTimeout(Duration.ofMillis(300))
                .build()) {
            backend.failWith(new BackendException(BackendErrorKind.SERVER, "mock", 500, "boom", null, null));

            assertThrows(DeadlineExceededException.class, () -> shortBridge.dispatch(hello()));
            assertEquals(1, backend.callCount());
        }
    }
}
