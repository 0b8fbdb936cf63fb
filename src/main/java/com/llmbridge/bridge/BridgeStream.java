package com.llmbridge.bridge;

import com.llmbridge.providers.ChunkStream;
import com.llmbridge.routing.Selection;
import com.llmbridge.shared.model.StreamChunk;

public final class BridgeStream implements ChunkStream {

    private final String requestId;
    private final Selection selection;
    private final ChunkStream chunks;

    BridgeStream(String requestId, Selection selection, ChunkStream chunks) {
        this.requestId = requestId;
        this.selection = selection;
        this.chunks = chunks;
    }

    public String requestId() { return requestId; }

    public String backend() { return selection != null ? selection.backend() : null; }

    public String model() { return selection != null ? selection.model() : null; }

    @Override
    public boolean hasNext() {
        return chunks.hasNext();
    }

    @Override
    public StreamChunk next() {
        return chunks.next();
    }

    @Override
    public void close() {
        chunks.close();
    }
}
