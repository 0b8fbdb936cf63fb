package com.llmbridge.middleware;

import com.llmbridge.bridge.RequestContext;
import com.llmbridge.errors.RateLimitException;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.Message;
import com.llmbridge.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitMiddlewareTest {

    private final MutableClock clock = new MutableClock();

    private static MiddlewareContext context(Map<String, String> metadata) {
        var request = ChatRequest.of(List.of(Message.user("hi"))).withMetadata(metadata);
        return new MiddlewareContext(request, RequestContext.of(request.id(), Duration.ofSeconds(5)), false);
    }

    @Test
    void failsFastOnceWindowIsFull() {
        var middleware = new RateLimitMiddleware(new SlidingWindowRateLimiter(2, Duration.ofSeconds(30), clock));

        middleware.handle(context(Map.of()), c -> c);
        middleware.handle(context(Map.of()), c -> c);
        var ex = assertThrows(RateLimitException.class, () -> middleware.handle(context(Map.of()), c -> c));

        assertEquals(Duration.ofSeconds(30), ex.retryAfter());
        assertTrue(ex.getMessage().contains(RateLimitMiddleware.GLOBAL_KEY));
    }

    @Test
    void usersHaveSeparateBuckets() {
        var middleware = new RateLimitMiddleware(new SlidingWindowRateLimiter(1, Duration.ofSeconds(30), clock));

        middleware.handle(context(Map.of("user", "alice")), c -> c);

        assertDoesNotThrow(() -> middleware.handle(context(Map.of("user", "bob")), c -> c));
        assertThrows(RateLimitException.class, () -> middleware.handle(context(Map.of("user", "alice")), c -> c));
    }

    @Test
    void rejectedRequestDoesNotProceed() {
        var middleware = new RateLimitMiddleware(new SlidingWindowRateLimiter(0, Duration.ofSeconds(30), clock));
        var proceeded = new boolean[1];

        assertThrows(RateLimitException.class, () -> middleware.handle(context(Map.of()), c -> {
            proceeded[0] = true;
            return c;
        }));
        assertFalse(proceeded[0]);
    }
}
