package com.llmbridge.routing;

import com.llmbridge.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackendHealthTest {

    private final MutableClock clock = new MutableClock();
    private final BackendHealth health = new BackendHealth(3, Duration.ofSeconds(60), clock);

    @Test
    void opensAfterConsecutiveFailures() {
        health.recordFailure("a");
        health.recordFailure("a");
        assertEquals(BackendHealth.State.CLOSED, health.state("a"));

        health.recordFailure("a");
        assertEquals(BackendHealth.State.OPEN, health.state("a"));
        assertFalse(health.isAvailable("a"));
    }

    @Test
    void successResetsFailureCount() {
        health.recordFailure("a");
        health.recordFailure("a");
        health.recordSuccess("a");
        health.recordFailure("a");
        health.recordFailure("a");

        assertTrue(health.isAvailable("a"));
    }

    @Test
    void halfOpenAfterCooldownThenClosesOnSuccess() {
        for (int i = 0; i < 3; i++) health.recordFailure("a");
        clock.advance(Duration.ofSeconds(61));

        assertEquals(BackendHealth.State.HALF_OPEN, health.state("a"));
        assertTrue(health.isAvailable("a"));

        health.recordSuccess("a");
        assertEquals(BackendHealth.State.CLOSED, health.state("a"));
    }

    @Test
    void failedProbeRestartsCooldown() {
        for (int i = 0; i < 3; i++) health.recordFailure("a");
        clock.advance(Duration.ofSeconds(61));
        health.recordFailure("a");

        assertEquals(BackendHealth.State.OPEN, health.state("a"));
        clock.advance(Duration.ofSeconds(30));
        assertEquals(BackendHealth.State.OPEN, health.state("a"));
    }

    @Test
    void backendsAreTrackedIndependently() {
        for (int i = 0; i < 3; i++) health.recordFailure("a");
        assertTrue(health.isAvailable("b"));
    }
}
