package com.llmbridge.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.llmbridge.shared.model.ChatResponse;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

public class InMemoryResponseCache implements ResponseCache {

    private record Entry(ChatResponse response, Duration ttl) {}

    private final Cache<String, Entry> entries;

    public InMemoryResponseCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public InMemoryResponseCache(int maxEntries, Clock clock) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be positive");
        this.entries = Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .expireAfter(new Expiry<String, Entry>() {
                @Override
                public long expireAfterCreate(String key, Entry entry, long currentTime) {
                    return entry.ttl().toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                    return entry.ttl().toNanos();
                }

                @Override
                public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .ticker(CacheTickers.from(clock))
            .executor(Runnable::run)
            .build();
    }

    @Override
    public Optional<ChatResponse> get(String fingerprint) {
        return Optional.ofNullable(entries.getIfPresent(fingerprint)).map(Entry::response);
    }

    @Override
    public void put(String fingerprint, ChatResponse response, Duration ttl) {
        entries.put(fingerprint, new Entry(response, ttl));
    }

    @Override
    public void invalidate(String fingerprint) {
        entries.invalidate(fingerprint);
    }

    @Override
    public void clear() {
        entries.invalidateAll();
    }

    @Override
    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }
}
