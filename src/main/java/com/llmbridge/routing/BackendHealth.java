package com.llmbridge.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

public class BackendHealth {

    private static final Logger log = LoggerFactory.getLogger(BackendHealth.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private record Entry(int failures, Instant openedAt) {}

    private final int threshold;
    private final Duration cooldown;
    private final Clock clock;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public BackendHealth() {
        this(5, Duration.ofSeconds(60), Clock.systemUTC());
    }

    public BackendHealth(int threshold, Duration cooldown, Clock clock) {
        this.threshold = threshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public State state(String backend) {
        var e = entries.get(backend);
        if (e == null || e.openedAt() == null) return State.CLOSED;
        return clock.instant().isBefore(e.openedAt().plus(cooldown)) ? State.OPEN : State.HALF_OPEN;
    }

    public boolean isAvailable(String backend) {
        return state(backend) != State.OPEN;
    }

    public void recordSuccess(String backend) {
        var previous = entries.remove(backend);
        if (previous != null && previous.openedAt() != null) {
            log.info("Backend {} recovered", backend);
        }
    }

    public void recordFailure(String backend) {
        var now = clock.instant();
        var updated = entries.merge(backend, new Entry(1, threshold <= 1 ? now : null), (old, one) -> {
            int failures = old.failures() + 1;
            // a failed half-open probe restarts the cooldown
            if (old.openedAt() != null) return new Entry(failures, now);
            return new Entry(failures, failures >= threshold ? now : null);
        });
        if (updated.failures() == threshold) {
            log.warn("Backend {} marked unhealthy after {} consecutive failures", backend, threshold);
        }
    }
}
