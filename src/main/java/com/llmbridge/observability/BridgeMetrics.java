package com.llmbridge.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class BridgeMetrics implements BridgeEventListener {

    private final MeterRegistry registry;

    public BridgeMetrics() {
        this(new SimpleMeterRegistry());
    }

    public BridgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter requests(String backend, String outcome) {
        return Counter.builder("llmbridge.requests")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .register(registry);
    }

    public Timer latency(String backend) {
        return Timer.builder("llmbridge.request.latency").tag("backend", backend).register(registry);
    }

    public Counter tokens(String backend) {
        return Counter.builder("llmbridge.tokens").tag("backend", backend).register(registry);
    }

    public Counter errors(String kind) {
        return Counter.builder("llmbridge.errors").tag("kind", kind).register(registry);
    }

    @Override
    public void onEvent(BridgeEvent event) {
        var backend = event.backend() != null ? event.backend() : "none";
        switch (event.type()) {
            case REQUEST_START -> { }
            case REQUEST_END -> {
                requests(backend, event.outcome().name().toLowerCase()).increment();
                latency(backend).record(event.duration());
                if (event.usage() != null) tokens(backend).increment(event.usage().totalTokens());
            }
            case REQUEST_ERROR -> {
                requests(backend, "failed").increment();
                errors(event.error() != null ? event.error().kind().name().toLowerCase() : "unknown").increment();
            }
        }
    }
}
