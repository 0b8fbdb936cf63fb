package com.llmbridge.streaming;

import com.llmbridge.bridge.RequestContext;
import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.errors.ErrorKind;
import com.llmbridge.providers.ChunkStream;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.StreamChunk;
import com.llmbridge.shared.model.Usage;
import com.llmbridge.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StreamTranslatorTest {

    /** Upstream that records how often it was pulled and whether it was closed. */
    static class RecordingStream implements ChunkStream {
        private final Iterator<Object> items;
        int pulls;
        boolean closed;

        RecordingStream(List<Object> items) {
            this.items = items.iterator();
        }

        @Override
        public boolean hasNext() {
            return !closed && items.hasNext();
        }

        @Override
        public StreamChunk next() {
            pulls++;
            var item = items.next();
            if (item instanceof RuntimeException e) throw e;
            return (StreamChunk) item;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static RequestContext context() {
        return RequestContext.of("req-1", Duration.ofSeconds(5));
    }

    private static List<StreamChunk> drain(ChunkStream stream) {
        var out = new ArrayList<StreamChunk>();
        while (stream.hasNext()) out.add(stream.next());
        return out;
    }

    @Test
    void sequencesFromZeroWithSingleTerminal() {
        var upstream = new RecordingStream(List.of(
                StreamChunk.delta("Hel"), StreamChunk.delta("lo"),
                StreamChunk.finish(FinishReason.STOP, Usage.of(3, 2))));

        var chunks = drain(new StreamTranslator(upstream, context()));

        assertEquals(3, chunks.size());
        for (int i = 0; i < chunks.size(); i++) assertEquals(i, chunks.get(i).sequence());
        assertEquals("Hello", chunks.get(0).delta() + chunks.get(1).delta());
        assertTrue(chunks.get(2).isTerminal());
        assertEquals(Usage.of(3, 2), chunks.get(2).usage());
        assertTrue(upstream.closed);
    }

    @Test
    void chunksAfterTerminalAreDropped() {
        var upstream = new RecordingStream(List.of(
                StreamChunk.delta("a"),
                StreamChunk.finish(FinishReason.LENGTH, null),
                StreamChunk.delta("ignored")));
        var translator = new StreamTranslator(upstream, context());

        var chunks = drain(translator);

        assertEquals(2, chunks.size());
        assertEquals(FinishReason.LENGTH, chunks.get(1).finishReason());
        assertEquals(StreamTranslator.State.TERMINATED, translator.state());
        assertThrows(NoSuchElementException.class, translator::next);
    }

    @Test
    void upstreamErrorBecomesTerminalErrorChunk() {
        var upstream = new RecordingStream(List.of(
                StreamChunk.delta("partial"),
                new BackendException(BackendErrorKind.SERVER, "openai", "connection reset")));

        var chunks = drain(new StreamTranslator(upstream, context()));

        assertEquals(2, chunks.size());
        var last = chunks.get(1);
        assertEquals(FinishReason.ERROR, last.finishReason());
        assertEquals(ErrorKind.BACKEND, last.error().kind());
        assertEquals("connection reset", last.error().message());
        assertEquals(1, last.sequence());
    }

    @Test
    void missingFinishIsSynthesized() {
        var upstream = new RecordingStream(List.of(StreamChunk.delta("a"), StreamChunk.delta("b")));

        var chunks = drain(new StreamTranslator(upstream, context()));

        assertEquals(3, chunks.size());
        assertEquals(FinishReason.STOP, chunks.get(2).finishReason());
        assertEquals(2, chunks.get(2).sequence());
    }

    @Test
    void pullsLazily() {
        var upstream = new RecordingStream(List.of(
                StreamChunk.delta("a"), StreamChunk.delta("b"), StreamChunk.delta("c"),
                StreamChunk.finish(FinishReason.STOP, null)));
        var translator = new StreamTranslator(upstream, context());

        assertEquals(0, upstream.pulls);
        assertTrue(translator.hasNext());
        assertEquals(1, upstream.pulls);
        translator.next();
        assertEquals(1, upstream.pulls);
    }

    @Test
    void closeCancelsUpstreamAndNotifiesObserver() {
        var upstream = new RecordingStream(List.of(
                StreamChunk.delta("a"), StreamChunk.delta("b"), StreamChunk.delta("c"),
                StreamChunk.finish(FinishReason.STOP, null)));
        var cancelledAfter = new AtomicLong(-1);
        var terminal = new AtomicReference<StreamChunk>();
        var translator = new StreamTranslator(upstream, context(), null, new StreamTranslator.Observer() {
            @Override
            public void onTerminal(StreamChunk chunk) {
                terminal.set(chunk);
            }

            @Override
            public void onCancelled(long delivered) {
                cancelledAfter.set(delivered);
            }
        });

        translator.next();
        translator.close();

        assertTrue(upstream.closed);
        assertFalse(translator.hasNext());
        assertEquals(1, upstream.pulls);
        assertEquals(1, cancelledAfter.get());
        assertNull(terminal.get());
    }

    @Test
    void observerSeesTerminalOnce() {
        var upstream = new RecordingStream(List.of(StreamChunk.delta("a"), StreamChunk.finish(FinishReason.STOP, null)));
        var terminals = new ArrayList<StreamChunk>();
        var translator = new StreamTranslator(upstream, context(), null, terminals::add);

        drain(translator);
        translator.close();

        assertEquals(1, terminals.size());
        assertEquals(FinishReason.STOP, terminals.get(0).finishReason());
    }

    @Test
    void expiredDeadlineEndsStreamWithTimeout() {
        var clock = new MutableClock();
        var rc = new RequestContext("req-1", Duration.ofSeconds(1), clock);
        var upstream = new RecordingStream(List.of(StreamChunk.delta("a"), StreamChunk.delta("b")));
        var translator = new StreamTranslator(upstream, rc);

        assertEquals("a", translator.next().delta());
        clock.advance(Duration.ofSeconds(2));
        var last = translator.next();

        assertEquals(FinishReason.ERROR, last.finishReason());
        assertEquals(ErrorKind.TIMEOUT, last.error().kind());
        assertFalse(translator.hasNext());
    }

    @Test
    void slowUpstreamIsBoundedByDeadline() {
        var executor = Executors.newSingleThreadExecutor();
        try {
            var rc = RequestContext.of("req-1", Duration.ofMillis(200));
            ChunkStream stalled = new ChunkStream() {
                @Override
                public boolean hasNext() {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return false;
                }

                @Override
                public StreamChunk next() {
                    throw new NoSuchElementException();
                }

                @Override
                public void close() {
                }
            };

            var chunks = drain(new StreamTranslator(stalled, rc, executor, null));

            assertEquals(1, chunks.size());
            assertEquals(ErrorKind.TIMEOUT, chunks.get(0).error().kind());
        } finally {
            executor.shutdownNow();
        }
    }
}
