package com.llmbridge.cache;

import com.llmbridge.shared.model.ChatResponse;

import java.time.Duration;
import java.util.Optional;

/**
 * Fingerprint → response store. Implementations may throw {@link com.llmbridge.errors.CacheException}
 * or any other unchecked exception when their storage is unavailable; callers treat that as a miss.
 */
public interface ResponseCache {

    Optional<ChatResponse> get(String fingerprint);

    void put(String fingerprint, ChatResponse response, Duration ttl);

    void invalidate(String fingerprint);

    void clear();

    int size();
}
