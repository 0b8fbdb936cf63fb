package com.llmbridge.cache;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

public class ModelCacheRegistry implements AutoCloseable {

    private final Clock clock;
    private final ConcurrentHashMap<String, ModelCache> caches = new ConcurrentHashMap<>();

    public ModelCacheRegistry() {
        this(Clock.systemUTC());
    }

    public ModelCacheRegistry(Clock clock) {
        this.clock = clock;
    }

    public ModelCache forScope(String scope) {
        return caches.computeIfAbsent(scope, s -> new ModelCache(s, clock));
    }

    @Override
    public void close() {
        caches.values().forEach(ModelCache::close);
        caches.clear();
    }
}
