package com.llmbridge.middleware;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.llmbridge.cache.CacheTickers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;

public class SlidingWindowRateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Cache<String, ArrayDeque<Instant>> windows;

    public SlidingWindowRateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, Clock.systemUTC());
    }

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(window)
                .ticker(CacheTickers.from(clock))
                .executor(Runnable::run)
                .build();
    }

    public int maxRequests() { return maxRequests; }

    public boolean tryAcquire(String key) {
        var deque = windows.get(key, k -> new ArrayDeque<>());
        synchronized (deque) {
            var now = clock.instant();
            evict(deque, now);
            if (deque.size() >= maxRequests) return false;
            deque.addLast(now);
            return true;
        }
    }

    public Duration retryAfter(String key) {
        var deque = windows.getIfPresent(key);
        if (deque == null) return Duration.ZERO;
        synchronized (deque) {
            var oldest = deque.peekFirst();
            if (oldest == null) return Duration.ZERO;
            var wait = Duration.between(clock.instant(), oldest.plus(window));
            return wait.isNegative() ? Duration.ZERO : wait;
        }
    }

    public int count(String key) {
        var deque = windows.getIfPresent(key);
        if (deque == null) return 0;
        synchronized (deque) {
            evict(deque, clock.instant());
            return deque.size();
        }
    }

    int trackedKeys() {
        windows.cleanUp();
        return (int) windows.estimatedSize();
    }

    private void evict(ArrayDeque<Instant> deque, Instant now) {
        var cutoff = now.minus(window);
        while (!deque.isEmpty() && !deque.peekFirst().isAfter(cutoff)) {
            deque.pollFirst();
        }
    }
}
