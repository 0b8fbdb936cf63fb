package com.llmbridge.middleware;

import com.llmbridge.bridge.Bridge;
import com.llmbridge.cache.InMemoryResponseCache;
import com.llmbridge.cache.RequestFingerprinter;
import com.llmbridge.cache.ResponseCache;
import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.errors.CacheException;
import com.llmbridge.providers.BackendRegistry;
import com.llmbridge.providers.MockBackend;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.Message;
import com.llmbridge.shared.model.ResponseSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CachingMiddlewareTest {

    private static ChatRequest question() {
        return ChatRequest.of(List.of(Message.user("What is the capital of France?")));
    }

    private static Bridge bridge(MockBackend backend, ResponseCache cache) {
        return Bridge.builder(new BackendRegistry().register(backend))
                .pipeline(MiddlewarePipeline.builder()
                        .use(new CachingMiddleware(cache, new RequestFingerprinter(), Duration.ofMinutes(5)))
                        .build())
                .build();
    }

    @Test
    void identicalRequestIsServedFromCache() {
        var backend = MockBackend.builder("mock").build().respondWith("Paris");
        try (var bridge = bridge(backend, new InMemoryResponseCache(100))) {
            var first = bridge.dispatch(question());
            var secondRequest = question();
            var second = bridge.dispatch(secondRequest);

            assertEquals(1, backend.callCount());
            assertEquals(ResponseSource.BACKEND, first.source());
            assertEquals(ResponseSource.CACHE, second.source());
            assertEquals("Paris", second.content());
            assertEquals(secondRequest.id(), second.requestId());
            assertEquals("mock", second.backend());
        }
    }

    @Test
    void differentParametersMissTheCache() {
        var backend = MockBackend.builder("mock").build();
        try (var bridge = bridge(backend, new InMemoryResponseCache(100))) {
            bridge.dispatch(question());
            bridge.dispatch(question().withParams(question().params().withTemperature(0.1)));

            assertEquals(2, backend.callCount());
        }
    }

    @Test
    void failuresAreNotCached() {
        var backend = MockBackend.builder("mock").build()
                .failWith(new BackendException(BackendErrorKind.AUTH, "mock", 401, "bad key", null, null));
        var cache = new InMemoryResponseCache(100);
        try (var bridge = bridge(backend, cache)) {
            assertThrows(BackendException.class, () -> bridge.dispatch(question()));
            assertEquals(0, cache.size());

            assertEquals(ResponseSource.BACKEND, bridge.dispatch(question()).source());
        }
    }

    @Test
    void brokenCacheBehavesLikeMiss() {
        var cache = mock(ResponseCache.class);
        when(cache.get(anyString())).thenThrow(new CacheException("store offline", null));
        doThrow(new CacheException("store offline", null)).when(cache).put(anyString(), any(), any());
        var backend = MockBackend.builder("mock").build();

        try (var bridge = bridge(backend, cache)) {
            var response = bridge.dispatch(question());

            assertEquals(FinishReason.STOP, response.finishReason());
            assertEquals(ResponseSource.BACKEND, response.source());
            assertEquals(1, backend.callCount());
        }
    }

    @Test
    void streamingBypassesCache() {
        var cache = mock(ResponseCache.class);
        var backend = MockBackend.builder("mock").build();

        try (var bridge = bridge(backend, cache); var stream = bridge.dispatchStream(question())) {
            while (stream.hasNext()) stream.next();
        }
        verifyNoInteractions(cache);
    }

    @Test
    void foreignCacheFailureStillReachesBackend() {
        var cache = mock(ResponseCache.class);
        when(cache.get(anyString())).thenThrow(new IllegalStateException("redis down"));
        doThrow(new IllegalStateException("redis down")).when(cache).put(anyString(), any(), any());
        var backend = MockBackend.builder("mock").build().respondWith("Paris");

        try (var bridge = bridge(backend, cache)) {
            var response = bridge.dispatch(question());

            assertEquals("Paris", response.content());
            assertEquals(1, backend.callCount());
        }
    }

    @Test
    void promptsDifferingOnlyInWhitespaceAreCachedSeparately() {
        var backend = MockBackend.builder("mock").build();
        try (var bridge = bridge(backend, new InMemoryResponseCache(100))) {
            var indented = bridge.dispatch(ChatRequest.of(List.of(Message.user("if x:\n    y()\nz()"))));
            var flattened = bridge.dispatch(ChatRequest.of(List.of(Message.user("if x: y() z()"))));

            assertEquals(2, backend.callCount());
            assertEquals(ResponseSource.BACKEND, flattened.source());
            assertEquals("Mock response to: if x: y() z()", flattened.content());
            assertNotEquals(indented.content(), flattened.content());
        }
    }
}
