package com.llmbridge.providers;

import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.Message;
import com.llmbridge.shared.model.ModelSource;
import com.llmbridge.shared.model.StreamChunk;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MockBackendTest {

    private static ChatRequest ask(String text) {
        return ChatRequest.of(List.of(Message.user(text)));
    }

    @Test
    void scriptIsConsumedInOrderThenEchoes() {
        var backend = MockBackend.builder("mock").build()
                .respondWith("first")
                .failWith(new BackendException(BackendErrorKind.SERVER, "mock", "down"));

        assertEquals("first", backend.call(ask("a")).content());
        assertThrows(BackendException.class, () -> backend.call(ask("b")));
        assertEquals("Mock response to: c", backend.call(ask("c")).content());
        assertEquals(3, backend.callCount());
        assertEquals("c", backend.requests().get(2).messages().get(0).textContent());
    }

    @Test
    void echoUsesDefaultModel() {
        var backend = MockBackend.builder("mock").defaultModel("m-1").build();

        var response = backend.call(ask("hi"));

        assertEquals("m-1", response.model());
        assertEquals("mock", response.backend());
        assertEquals(FinishReason.STOP, response.finishReason());
    }

    @Test
    void defaultStreamSplitsWords() {
        var backend = MockBackend.builder("mock").build();

        var chunks = new ArrayList<StreamChunk>();
        try (var stream = backend.stream(ask("go"))) {
            while (stream.hasNext()) chunks.add(stream.next());
        }

        assertEquals(List.of("Mock ", "response ", "to: ", "go", ""),
                chunks.stream().map(StreamChunk::delta).toList());
        assertTrue(chunks.get(chunks.size() - 1).isTerminal());
    }

    @Test
    void catalogFromRemoteListing() {
        var backend = MockBackend.builder("mock")
                .remoteModels(List.of(AIModel.of("a"), AIModel.of("b")))
                .build();

        var result = backend.listModels(ListModelsOptions.defaults());

        assertEquals(ModelSource.REMOTE, result.source());
        assertEquals(2, result.models().size());
        assertEquals(1, backend.fetchCount());
    }

    @Test
    void failingListingFallsBackToDefaults() {
        var backend = MockBackend.builder("mock")
                .remoteModels(List.of(AIModel.of("a")))
                .defaultModels(List.of(AIModel.of("fallback")))
                .build()
                .failListing(true);

        var result = backend.listModels(ListModelsOptions.defaults());

        assertEquals(ModelSource.STATIC, result.source());
        assertTrue(result.contains("fallback"));
    }

    @Test
    void staticModelsOverrideEverything() {
        var backend = MockBackend.builder("mock")
                .remoteModels(List.of(AIModel.of("a")))
                .staticModels(List.of("pinned-1", "pinned-2"))
                .build();

        var result = backend.listModels(ListModelsOptions.refresh());

        assertEquals(ModelSource.STATIC, result.source());
        assertTrue(result.contains("pinned-2"));
        assertEquals(0, backend.fetchCount());
    }
}
