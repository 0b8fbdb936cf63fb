package com.llmbridge.cache;

import com.llmbridge.errors.CacheException;
import com.llmbridge.providers.ListModelsOptions;
import com.llmbridge.providers.MockBackend;
import com.llmbridge.routing.CapabilityFilter;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;
import com.llmbridge.shared.model.ModelSource;
import com.llmbridge.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CatalogResolverTest {

    private final MutableClock clock = new MutableClock();
    private final ModelCache cache = new ModelCache("test", clock);

    private MockBackend backend() {
        return MockBackend.builder("mock")
                .remoteModels(List.of(AIModel.of("remote-a"), AIModel.of("remote-b")))
                .modelCache(cache)
                .build();
    }

    @Test
    void secondListingWithinTtlDoesNotFetch() {
        var backend = backend();

        var first = backend.listModels(ListModelsOptions.defaults());
        var second = backend.listModels(ListModelsOptions.defaults());

        assertEquals(1, backend.fetchCount());
        assertEquals(ModelSource.REMOTE, first.source());
        assertEquals(ModelSource.REMOTE, second.source());
        assertEquals(first.fetchedAt(), second.fetchedAt());
    }

    @Test
    void invalidateCausesExactlyOneFetch() {
        var backend = backend();
        backend.listModels(ListModelsOptions.defaults());

        cache.invalidate("mock");
        backend.listModels(ListModelsOptions.defaults());
        backend.listModels(ListModelsOptions.defaults());

        assertEquals(2, backend.fetchCount());
    }

    @Test
    void forceRefreshBypassesFreshEntry() {
        var backend = backend();
        backend.listModels(ListModelsOptions.defaults());

        backend.listModels(ListModelsOptions.refresh());

        assertEquals(2, backend.fetchCount());
    }

    @Test
    void expiredEntryIsRefetched() {
        var backend = backend();
        backend.listModels(ListModelsOptions.defaults());
        clock.advance(Duration.ofHours(2));

        backend.listModels(ListModelsOptions.defaults());

        assertEquals(2, backend.fetchCount());
    }

    @Test
    void failedFetchServesStaleEntryWithoutAdvancingTimestamp() {
        var backend = backend();
        var fresh = backend.listModels(ListModelsOptions.defaults());
        clock.advance(Duration.ofHours(2));
        backend.failListing(true);

        var result = backend.listModels(ListModelsOptions.defaults());

        assertEquals(ModelSource.STALE, result.source());
        assertEquals(fresh.fetchedAt(), result.fetchedAt());
        assertEquals(List.of("remote-a", "remote-b"), result.models().stream().map(AIModel::id).toList());
        assertEquals(ModelSource.REMOTE, cache.peek("mock").orElseThrow().source());
    }

    @Test
    void failedFetchWithoutCacheFallsBackToDefaults() {
        var backend = backend().failListing(true);

        var result = backend.listModels(ListModelsOptions.defaults());

        assertEquals(ModelSource.STATIC, result.source());
        assertEquals("mock-model", result.models().get(0).id());
        assertTrue(result.complete());
        assertTrue(cache.keys().isEmpty());
    }

    @Test
    void staticOverrideBypassesCacheAndNetwork() {
        var backend = MockBackend.builder("mock")
                .remoteModels(List.of(AIModel.of("remote-a")))
                .staticModels(List.of("pinned-1", "pinned-2"))
                .modelCache(cache)
                .build();

        var result = backend.listModels(ListModelsOptions.refresh());

        assertEquals(0, backend.fetchCount());
        assertEquals(ModelSource.STATIC, result.source());
        assertEquals(2, result.models().size());
    }

    @Test
    void filterAppliesToFinalResult() {
        var backend = MockBackend.builder("mock")
                .capabilities(Capabilities.textOnly(8_192))
                .remoteModels(List.of(AIModel.of("text-only"), AIModel.of("seeing", Capabilities.full(32_000))))
                .modelCache(cache)
                .build();

        var result = backend.listModels(ListModelsOptions.filtered(CapabilityFilter.requireVision()));

        assertEquals(List.of("seeing"), result.models().stream().map(AIModel::id).toList());
    }

    @Test
    void brokenCacheDegradesToLiveFetch() {
        var broken = mock(ModelCache.class);
        when(broken.get(anyString())).thenThrow(new CacheException("down", null));
        doThrow(new CacheException("down", null)).when(broken).set(anyString(), any(), any());
        var fetches = new AtomicInteger();
        var resolver = new CatalogResolver("x", broken, null, List.of(AIModel.of("fallback")),
                Duration.ofMinutes(10), clock);

        var result = resolver.resolve(ListModelsOptions.defaults(), () -> {
            fetches.incrementAndGet();
            return List.of(AIModel.of("live"));
        }, Capabilities.textOnly(4_096));

        assertEquals(1, fetches.get());
        assertEquals(ModelSource.REMOTE, result.source());
        assertEquals("live", result.models().get(0).id());
    }

    @Test
    void withoutFetcherDefaultsAreUsed() {
        var resolver = new CatalogResolver("anthropic", cache, null, List.of(AIModel.of("claude")),
                null, clock);

        var result = resolver.resolve(null, null, Capabilities.full(200_000));

        assertEquals(ModelSource.STATIC, result.source());
        assertTrue(result.contains("claude"));
    }

    @Test
    void emptyDefaultsAreMarkedIncomplete() {
        var resolver = new CatalogResolver("ollama", cache, null, List.of(), null, clock);

        var result = resolver.resolve(ListModelsOptions.defaults(), () -> {
            throw new IllegalStateException("connection refused");
        }, Capabilities.textOnly(8_192));

        assertFalse(result.complete());
        assertTrue(result.models().isEmpty());
    }
}
