package com.llmbridge.providers;

import com.llmbridge.errors.StreamException;
import com.llmbridge.shared.model.StreamChunk;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Lazily decodes a server-sent-events body into chunks. Lines are read only when the consumer
 * pulls; closing the stream closes the HTTP body.
 */
abstract class SseChunkStream implements ChunkStream {

    private final Stream<String> lines;
    private final Iterator<String> source;
    private final ArrayDeque<StreamChunk> pending = new ArrayDeque<>();
    private boolean ended;
    private boolean closed;

    protected SseChunkStream(Stream<String> lines) {
        this.lines = lines;
        this.source = lines.iterator();
    }

    protected abstract boolean onData(String data, Consumer<StreamChunk> emit) throws Exception;

    protected void onEnd(Consumer<StreamChunk> emit) {}

    @Override
    public boolean hasNext() {
        if (closed) return false;
        while (pending.isEmpty() && !ended) {
            if (!source.hasNext()) {
                ended = true;
                onEnd(pending::add);
                break;
            }
            var line = source.next().trim();
            if (!line.startsWith("data:")) continue;
            var data = line.substring(5).trim();
            if (data.isEmpty()) continue;
            try {
                if (!onData(data, pending::add)) {
                    ended = true;
                    onEnd(pending::add);
                }
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new StreamException("Malformed stream event: " + e.getMessage(), e);
            }
        }
        return !pending.isEmpty();
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) throw new NoSuchElementException();
        return pending.poll();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        pending.clear();
        lines.close();
    }
}
