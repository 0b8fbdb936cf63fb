package com.llmbridge.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class ModelCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

    private record Slot(ModelCacheEntry entry, Duration ttl) {}

    private final String scope;
    private final Cache<String, Slot> fresh;
    private final ConcurrentHashMap<String, ModelCacheEntry> lastKnown = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ModelCache(String scope) {
        this(scope, Clock.systemUTC());
    }

    public ModelCache(String scope, Clock clock) {
        this.scope = scope;
        this.fresh = Caffeine.newBuilder()
            .expireAfter(new Expiry<String, Slot>() {
                @Override
                public long expireAfterCreate(String key, Slot slot, long currentTime) {
                    return slot.ttl().toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Slot slot, long currentTime, long currentDuration) {
                    return slot.ttl().toNanos();
                }

                @Override
                public long expireAfterRead(String key, Slot slot, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .ticker(CacheTickers.from(clock))
            .executor(Runnable::run)
            .build();
    }

    public String scope() { return scope; }

    public Optional<ModelCacheEntry> get(String adapterName) {
        return Optional.ofNullable(fresh.getIfPresent(adapterName)).map(Slot::entry);
    }

    public Optional<ModelCacheEntry> peek(String adapterName) {
        return Optional.ofNullable(lastKnown.get(adapterName));
    }

    public void set(String adapterName, ModelCacheEntry entry, Duration ttl) {
        if (closed) {
            log.debug("Ignoring write to closed model cache scope={}", scope);
            return;
        }
        lastKnown.put(adapterName, entry);
        fresh.put(adapterName, new Slot(entry, ttl));
    }

    public void invalidate(String adapterName) {
        fresh.invalidate(adapterName);
        lastKnown.remove(adapterName);
    }

    public void clear() {
        fresh.invalidateAll();
        lastKnown.clear();
    }

    public Set<String> keys() {
        return Set.copyOf(lastKnown.keySet());
    }

    @Override
    public void close() {
        closed = true;
        clear();
    }
}
