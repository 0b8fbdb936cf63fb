package com.llmbridge.bridge;

import com.llmbridge.errors.BridgeException;
import com.llmbridge.errors.DeadlineExceededException;
import com.llmbridge.errors.ErrorKind;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-dispatch state shared across middleware, retries and the backend call: the request id,
 * the absolute deadline, cancellation and the attempt counter.
 */
public class RequestContext {

    private final String requestId;
    private final Clock clock;
    private final Instant startedAt;
    private final Duration timeout;
    private final Instant deadline;
    private final CancellationSignal cancellation = new CancellationSignal();
    private final AtomicInteger attempt = new AtomicInteger(1);

    public RequestContext(String requestId, Duration timeout, Clock clock) {
        this.requestId = requestId;
        this.clock = clock;
        this.timeout = timeout;
        this.startedAt = clock.instant();
        this.deadline = startedAt.plus(timeout);
    }

    public static RequestContext of(String requestId, Duration timeout) {
        return new RequestContext(requestId, timeout, Clock.systemUTC());
    }

    public String requestId() { return requestId; }

    public Instant startedAt() { return startedAt; }

    public Instant deadline() { return deadline; }

    public Duration timeout() { return timeout; }

    public Clock clock() { return clock; }

    public CancellationSignal cancellation() { return cancellation; }

    public int attempt() { return attempt.get(); }

    public int nextAttempt() { return attempt.incrementAndGet(); }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public Duration remaining() {
        var left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public void cancel() {
        cancellation.cancel();
    }

    public void checkActive() {
        if (cancellation.isCancelled()) {
            throw new BridgeException(ErrorKind.TIMEOUT, "Request " + requestId + " cancelled");
        }
        if (isExpired()) {
            throw new DeadlineExceededException(requestId, timeout);
        }
    }

    public void sleep(Duration duration) {
        checkActive();
        if (duration.compareTo(remaining()) >= 0) {
            throw new DeadlineExceededException(requestId, timeout);
        }
        try {
            if (cancellation.await(duration)) checkActive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException(ErrorKind.TIMEOUT, "Request " + requestId + " interrupted", false, e);
        }
    }
}
