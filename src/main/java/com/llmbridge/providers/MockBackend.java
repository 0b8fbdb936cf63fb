package com.llmbridge.providers;

import com.llmbridge.cache.ModelCache;
import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ChatResponse;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.Message;
import com.llmbridge.shared.model.Role;
import com.llmbridge.shared.model.StreamChunk;
import com.llmbridge.shared.model.Usage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public class MockBackend extends AbstractBackendAdapter {

    private final ConcurrentLinkedDeque<Object> script = new ConcurrentLinkedDeque<>();
    private final ConcurrentLinkedDeque<List<StreamChunk>> streamScript = new ConcurrentLinkedDeque<>();
    private final List<ChatRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicBoolean failListing = new AtomicBoolean();
    private final List<AIModel> remoteModels;
    private volatile Duration latency;

    private MockBackend(Builder b) {
        super(BackendSettings.of(b.name, null, null, b.defaultModel)
                        .withCost(b.costPer1kTokens)
                        .withModels(b.staticModels),
                b.capabilities, b.remoteModels != null, b.defaultModels, b.cache);
        this.remoteModels = b.remoteModels;
        this.latency = b.latency;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public MockBackend respondWith(String content) {
        script.add(ChatResponse.of(null, content, FinishReason.STOP, Usage.of(10, 5)));
        return this;
    }

    public MockBackend respondWith(ChatResponse response) {
        script.add(response);
        return this;
    }

    public MockBackend failWith(RuntimeException error) {
        script.add(error);
        return this;
    }

    public MockBackend streamWith(List<StreamChunk> chunks) {
        streamScript.add(List.copyOf(chunks));
        return this;
    }

    public MockBackend latency(Duration latency) {
        this.latency = latency;
        return this;
    }

    public MockBackend failListing(boolean fail) {
        failListing.set(fail);
        return this;
    }

    public int callCount() { return calls.get(); }

    public int fetchCount() { return fetches.get(); }

    public List<ChatRequest> requests() { return List.copyOf(requests); }

    @Override
    public ChatResponse call(ChatRequest request) {
        calls.incrementAndGet();
        requests.add(request);
        pause();
        var next = script.poll();
        if (next instanceof RuntimeException e) throw e;
        if (next instanceof ChatResponse r) return r.withRequestId(request.id());
        var content = echo(request);
        return new ChatResponse(request.id(), Message.assistant(content), FinishReason.STOP,
                Usage.of(request.totalTextLength() / 4 + 1, content.length() / 4 + 1),
                name(), resolveModel(request), Duration.ZERO, null);
    }

    @Override
    public ChunkStream stream(ChatRequest request) {
        calls.incrementAndGet();
        requests.add(request);
        pause();
        var next = script.peek();
        if (next instanceof RuntimeException e) {
            script.poll();
            throw e;
        }
        var scripted = streamScript.poll();
        if (scripted != null) return ChunkStream.of(scripted);
        var chunks = new ArrayList<StreamChunk>();
        for (var word : echo(request).split("(?<= )")) {
            chunks.add(StreamChunk.delta(word));
        }
        chunks.add(StreamChunk.finish(FinishReason.STOP, Usage.of(request.totalTextLength() / 4 + 1, chunks.size())));
        return ChunkStream.of(chunks);
    }

    @Override
    protected List<AIModel> fetchRemoteModels() {
        fetches.incrementAndGet();
        if (failListing.get()) {
            throw new BackendException(BackendErrorKind.SERVER, name(), "listing unavailable");
        }
        return remoteModels;
    }

    private void pause() {
        var d = latency;
        if (d == null || d.isZero()) return;
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            throw HttpErrors.interrupted(name(), e);
        }
    }

    private static String echo(ChatRequest request) {
        for (int i = request.messages().size() - 1; i >= 0; i--) {
            var m = request.messages().get(i);
            if (m.role() == Role.USER) return "Mock response to: " + m.textContent();
        }
        return "Mock response";
    }

    public static class Builder {
        private final String name;
        private Capabilities capabilities = Capabilities.full(128_000);
        private String defaultModel = "mock-model";
        private double costPer1kTokens;
        private List<AIModel> defaultModels;
        private List<AIModel> remoteModels;
        private List<String> staticModels = List.of();
        private Duration latency = Duration.ZERO;
        private ModelCache cache;

        private Builder(String name) {
            this.name = name;
        }

        public Builder capabilities(Capabilities capabilities) { this.capabilities = capabilities; return this; }
        public Builder defaultModel(String model) { this.defaultModel = model; return this; }
        public Builder cost(double costPer1kTokens) { this.costPer1kTokens = costPer1kTokens; return this; }
        public Builder defaultModels(List<AIModel> models) { this.defaultModels = models; return this; }
        public Builder remoteModels(List<AIModel> models) { this.remoteModels = models; return this; }
        public Builder staticModels(List<String> models) { this.staticModels = models; return this; }
        public Builder latency(Duration latency) { this.latency = latency; return this; }
        public Builder modelCache(ModelCache cache) { this.cache = cache; return this; }

        public MockBackend build() {
            if (defaultModels == null) defaultModels = List.of(AIModel.of(defaultModel));
            return new MockBackend(this);
        }
    }
}
