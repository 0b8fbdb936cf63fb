package com.llmbridge.providers;

import com.llmbridge.shared.model.StreamChunk;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pull-based, finite, non-restartable chunk sequence. Upstream work only happens when the
 * consumer asks for the next chunk; {@link #close()} cancels and releases upstream resources.
 */
public interface ChunkStream extends Iterator<StreamChunk>, AutoCloseable {

    @Override
    void close();

    static ChunkStream of(List<StreamChunk> chunks) {
        var it = List.copyOf(chunks).iterator();
        return new ChunkStream() {
            private boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && it.hasNext();
            }

            @Override
            public StreamChunk next() {
                if (!hasNext()) throw new NoSuchElementException();
                return it.next();
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }
}
