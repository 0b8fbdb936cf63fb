package com.llmbridge.streaming;

import com.llmbridge.bridge.RequestContext;
import com.llmbridge.errors.BridgeException;
import com.llmbridge.errors.DeadlineExceededException;
import com.llmbridge.errors.ErrorKind;
import com.llmbridge.errors.StreamException;
import com.llmbridge.providers.ChunkStream;
import com.llmbridge.shared.model.ErrorInfo;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.StreamChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Normalizes a backend chunk stream for the caller.
 * <ul>
 *   <li>sequence numbers restart at 0 and increase by one</li>
 *   <li>exactly one terminal chunk, always last; upstream errors and deadline expiry become a
 *       terminal {@code ERROR} chunk instead of an exception</li>
 *   <li>an upstream that ends without a finish reason gets a synthesized {@code STOP}</li>
 *   <li>at most one chunk is buffered; nothing is pulled upstream until the caller asks</li>
 *   <li>{@link #close()} cancels upstream, after which nothing more is pulled</li>
 * </ul>
 * When an executor is given, each upstream pull is bounded by the remaining deadline.
 */
public class StreamTranslator implements ChunkStream {

    private static final Logger log = LoggerFactory.getLogger(StreamTranslator.class);

    public enum State { IDLE, ACTIVE, TERMINATED }

    public interface Observer {
        void onTerminal(StreamChunk terminal);

        default void onCancelled(long delivered) {}
    }

    private static final Observer NO_OP = terminal -> { };

    private final ChunkStream upstream;
    private final RequestContext context;
    private final ExecutorService executor;
    private final Observer observer;

    private volatile State state = State.IDLE;
    private volatile boolean closed;
    private StreamChunk lookahead;
    private long sequence;

    public StreamTranslator(ChunkStream upstream, RequestContext context) {
        this(upstream, context, null, null);
    }

    public StreamTranslator(ChunkStream upstream, RequestContext context,
                            ExecutorService executor, Observer observer) {
        this.upstream = upstream;
        this.context = context;
        this.executor = executor;
        this.observer = observer != null ? observer : NO_OP;
    }

    public State state() {
        return state;
    }

    @Override
    public synchronized boolean hasNext() {
        if (lookahead != null) return true;
        if (closed || state == State.TERMINATED) return false;
        lookahead = advance();
        return lookahead != null;
    }

    @Override
    public synchronized StreamChunk next() {
        if (!hasNext()) throw new NoSuchElementException();
        var chunk = lookahead;
        lookahead = null;
        return chunk;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        var wasOpen = state != State.TERMINATED;
        state = State.TERMINATED;
        closeUpstream();
        if (wasOpen) {
            log.debug("Stream {} cancelled by consumer after {} chunks", requestId(), sequence);
            observer.onCancelled(sequence);
        }
    }

    private StreamChunk advance() {
        state = State.ACTIVE;
        StreamChunk raw;
        try {
            if (context != null) context.checkActive();
            raw = pull();
        } catch (RuntimeException e) {
            if (closed) return null;
            return terminate(StreamChunk.failure(toErrorInfo(e)));
        }
        if (closed) return null;
        if (raw == null) {
            return terminate(StreamChunk.finish(FinishReason.STOP, null));
        }
        if (raw.isTerminal()) {
            return terminate(raw);
        }
        return raw.withSequence(sequence++);
    }

    private StreamChunk pull() {
        if (executor == null || context == null) {
            return upstream.hasNext() ? upstream.next() : null;
        }
        var future = executor.submit(() -> upstream.hasNext() ? upstream.next() : null);
        try {
            return future.get(context.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DeadlineExceededException(context.requestId(), context.timeout(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new StreamException("Upstream stream failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StreamException("Interrupted while waiting for upstream chunk", e);
        }
    }

    private StreamChunk terminate(StreamChunk terminal) {
        state = State.TERMINATED;
        closeUpstream();
        var chunk = terminal.withSequence(sequence++);
        try {
            observer.onTerminal(chunk);
        } catch (RuntimeException e) {
            log.warn("Stream observer failed for {}: {}", requestId(), e.getMessage());
        }
        return chunk;
    }

    private void closeUpstream() {
        try {
            upstream.close();
        } catch (RuntimeException e) {
            log.debug("Closing upstream stream for {} failed: {}", requestId(), e.getMessage());
        }
    }

    private String requestId() {
        return context != null ? context.requestId() : "?";
    }

    static ErrorInfo toErrorInfo(RuntimeException e) {
        if (e instanceof BridgeException be) return new ErrorInfo(be.kind(), be.getMessage());
        return new ErrorInfo(ErrorKind.STREAM, e.getMessage());
    }
}
