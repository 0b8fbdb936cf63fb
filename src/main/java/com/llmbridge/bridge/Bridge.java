package com.llmbridge.bridge;

import com.llmbridge.cache.ModelCacheRegistry;
import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.errors.BridgeException;
import com.llmbridge.errors.DeadlineExceededException;
import com.llmbridge.errors.ErrorKind;
import com.llmbridge.errors.NoCandidateException;
import com.llmbridge.middleware.MiddlewareContext;
import com.llmbridge.middleware.MiddlewarePipeline;
import com.llmbridge.middleware.StateKeys;
import com.llmbridge.observability.BridgeEvent;
import com.llmbridge.observability.EventDispatcher;
import com.llmbridge.providers.BackendAdapter;
import com.llmbridge.providers.BackendRegistry;
import com.llmbridge.providers.ChunkStream;
import com.llmbridge.providers.ListModelsOptions;
import com.llmbridge.providers.ListModelsResult;
import com.llmbridge.routing.Candidate;
import com.llmbridge.routing.CapabilityFilter;
import com.llmbridge.routing.Router;
import com.llmbridge.routing.RoutingPolicy;
import com.llmbridge.routing.Selection;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ChatResponse;
import com.llmbridge.shared.model.ErrorInfo;
import com.llmbridge.shared.model.FinishReason;
import com.llmbridge.shared.model.ResponseSource;
import com.llmbridge.shared.model.StreamChunk;
import com.llmbridge.streaming.StreamTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates one dispatch: middleware pre-phase, routing, the backend call, post-phase and
 * lifecycle events. Safe for concurrent use; per-dispatch state lives in {@link RequestContext}
 * and {@link MiddlewareContext}, and no lock is held while a backend call is outstanding.
 */
public class Bridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Bridge.class);

    private final BackendRegistry registry;
    private final Router router;
    private final RoutingPolicy policy;
    private final CapabilityFilter defaultFilter;
    private final MiddlewarePipeline pipeline;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final EventDispatcher events;
    private final ModelCacheRegistry modelCaches;
    private final Clock clock;
    private final Duration defaultTimeout;
    private volatile boolean closed;

    private Bridge(Builder b) {
        this.registry = b.registry;
        this.router = b.router != null ? b.router : new Router();
        this.policy = b.policy;
        this.defaultFilter = b.defaultFilter != null ? b.defaultFilter : CapabilityFilter.NONE;
        this.pipeline = b.pipeline != null ? b.pipeline : MiddlewarePipeline.empty();
        this.ownsExecutor = b.executor == null;
        this.executor = b.executor != null ? b.executor : Executors.newCachedThreadPool(workerThreads());
        this.events = b.events != null ? b.events : EventDispatcher.direct();
        this.modelCaches = b.modelCaches;
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.defaultTimeout = b.defaultTimeout != null ? b.defaultTimeout : Duration.ofSeconds(30);
    }

    public static Builder builder(BackendRegistry registry) {
        return new Builder(registry);
    }

    public BackendRegistry registry() { return registry; }

    public Router router() { return router; }

    public EventDispatcher events() { return events; }

    public ChatResponse dispatch(ChatRequest request) {
        return dispatch(request, DispatchOptions.defaults());
    }

    public ChatResponse dispatch(ChatRequest request, DispatchOptions options) {
        ensureOpen();
        var opts = options != null ? options : DispatchOptions.defaults();
        var req = request.stream() ? request.withStream(false) : request;
        var rc = new RequestContext(req.id(), timeoutOf(opts), clock);
        events.emit(BridgeEvent.start(req.id(), false, clock.instant()));

        var ctx = context(req, rc, false, opts);
        try {
            var result = pipeline.execute(ctx, c -> terminal(c, opts));
            var response = result.response();
            if (response == null) {
                throw BridgeException.internal("Pipeline completed without a response", null);
            }
            response = response.withRequestId(req.id()).withDuration(rc.elapsed());
            emitEnd(rc, ctx, response.backend(), response.model(), response, false);
            return response;
        } catch (RuntimeException e) {
            var error = classify(e, rc);
            emitError(rc, ctx, error, false);
            throw error;
        }
    }

    /**
     * Runs the pre-phase and opens the backend stream before returning; failures up to that point
     * are thrown. Afterwards every failure arrives as a terminal ERROR chunk.
     */
    public BridgeStream dispatchStream(ChatRequest request, DispatchOptions options) {
        ensureOpen();
        var opts = options != null ? options : DispatchOptions.defaults();
        var req = request.withStream(true);
        var rc = new RequestContext(req.id(), timeoutOf(opts), clock);
        events.emit(BridgeEvent.start(req.id(), true, clock.instant()));

        var ctx = context(req, rc, true, opts);
        try {
            var result = pipeline.execute(ctx, c -> terminal(c, opts));
            var upstream = result.stream();
            if (upstream == null && result.response() != null) {
                upstream = replay(result.response());
            }
            if (upstream == null) {
                throw BridgeException.internal("Pipeline completed without a stream", null);
            }
            var selection = result.get(StateKeys.SELECTION, Selection.class).orElse(null);
            var translator = new StreamTranslator(upstream, rc, executor, new StreamObserver(rc, ctx, selection));
            return new BridgeStream(req.id(), selection, translator);
        } catch (RuntimeException e) {
            var error = classify(e, rc);
            emitError(rc, ctx, error, true);
            throw error;
        }
    }

    public BridgeStream dispatchStream(ChatRequest request) {
        return dispatchStream(request, DispatchOptions.defaults());
    }

    public ListModelsResult listModels(String backend, ListModelsOptions options) {
        var adapter = registry.get(backend)
                .orElseThrow(() -> new NoCandidateException("Unknown backend: " + backend));
        return adapter.listModels(options);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (modelCaches != null) modelCaches.close();
        log.info("Bridge closed");
    }

    private MiddlewareContext terminal(MiddlewareContext ctx, DispatchOptions opts) {
        var rc = ctx.requestContext();
        rc.checkActive();
        // memoised so retries reuse the first routing decision
        var selection = ctx.get(StateKeys.SELECTION, Selection.class).orElse(null);
        if (selection == null) {
            selection = route(ctx.request(), opts, failedOver(ctx));
            ctx.put(StateKeys.SELECTION, selection);
        }
        var target = selection;
        BackendAdapter backend = registry.get(target.backend())
                .orElseThrow(() -> new NoCandidateException("Unknown backend: " + target.backend()));
        var routed = ctx.request().withModel(target.model());

        if (ctx.streaming()) {
            ctx.setStream(invoke(target.backend(), () -> backend.stream(routed), rc, opts));
            return ctx;
        }
        var response = invoke(target.backend(), () -> backend.call(routed), rc, opts);
        var model = response.model() != null ? response.model() : target.model();
        ctx.setResponse(response.withRequestId(routed.id())
                .withProvenance(target.backend(), model)
                .withSource(ResponseSource.BACKEND));
        return ctx;
    }

    private static MiddlewareContext context(ChatRequest req, RequestContext rc, boolean streaming,
                                             DispatchOptions opts) {
        var ctx = new MiddlewareContext(req, rc, streaming);
        if (opts.backend() != null) ctx.put(StateKeys.PINNED_BACKEND, opts.backend());
        return ctx;
    }

    @SuppressWarnings("unchecked")
    private static List<String> failedOver(MiddlewareContext ctx) {
        return ctx.get(StateKeys.FAILED_OVER, List.class).orElse(List.of());
    }

    private Selection route(ChatRequest request, DispatchOptions opts, List<String> excluded) {
        var filter = defaultFilter.merge(opts.filter()).merge(CapabilityFilter.inferFrom(request));
        List<BackendAdapter> pool;
        if (opts.backend() != null) {
            pool = List.of(registry.get(opts.backend())
                    .orElseThrow(() -> new NoCandidateException("Unknown backend: " + opts.backend())));
        } else {
            pool = registry.all().stream().filter(b -> !excluded.contains(b.name())).toList();
        }
        if (pool.isEmpty()) {
            throw new NoCandidateException(excluded.isEmpty() ? "No backends registered"
                    : "No backends left after failing over from " + excluded);
        }

        var listing = new ListModelsOptions(opts.forceRefresh(), null);
        var candidates = pool.stream()
                .map(b -> new Candidate(b.metadata(), b.listModels(listing).models()))
                .toList();
        var selection = router.select(candidates, filter, opts.backend() != null ? null : policy, request);
        log.debug("Request {} routed to {}/{} ({})", request.id(), selection.backend(), selection.model(),
                selection.reason());
        return selection;
    }

    private <T> T invoke(String backend, Callable<T> call, RequestContext rc, DispatchOptions opts) {
        var remaining = rc.remaining();
        var attemptTimeout = opts.attemptTimeout();
        boolean attemptBound = attemptTimeout != null && attemptTimeout.compareTo(remaining) < 0;
        var budget = attemptBound ? attemptTimeout : remaining;
        if (budget.isZero()) throw new DeadlineExceededException(rc.requestId(), rc.timeout());

        // first to claim owns the result; a late result is released by the worker
        var claimed = new AtomicBoolean();
        var future = executor.submit(() -> {
            T result = call.call();
            if (!claimed.compareAndSet(false, true)) release(backend, result);
            return result;
        });
        rc.cancellation().onCancel(() -> {
            if (claimed.compareAndSet(false, true)) future.cancel(true);
        });
        try {
            T result = future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            router.health().recordSuccess(backend);
            return result;
        } catch (TimeoutException e) {
            if (claimed.compareAndSet(false, true)) {
                future.cancel(true);
            } else {
                releaseCompleted(backend, future);
            }
            router.health().recordFailure(backend);
            if (!attemptBound) throw new DeadlineExceededException(rc.requestId(), rc.timeout(), e);
            throw new BackendException(BackendErrorKind.TIMEOUT, backend, 0,
                    backend + " attempt " + rc.attempt() + " exceeded " + budget.toMillis() + "ms", null, e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof BackendException be) {
                if (be.backendKind() != BackendErrorKind.INVALID_REQUEST) router.health().recordFailure(backend);
                throw be;
            }
            router.health().recordFailure(backend);
            if (cause instanceof BridgeException be) throw be;
            throw new BackendException(BackendErrorKind.UNKNOWN, backend, 0,
                    backend + " failed: " + cause, null, cause);
        } catch (CancellationException e) {
            throw new BridgeException(ErrorKind.TIMEOUT, "Request " + rc.requestId() + " cancelled", false, e);
        } catch (InterruptedException e) {
            if (claimed.compareAndSet(false, true)) future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BridgeException(ErrorKind.TIMEOUT, "Request " + rc.requestId() + " interrupted", false, e);
        }
    }

    private static void releaseCompleted(String backend, Future<?> future) {
        try {
            release(backend, future.get(1, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | CancellationException e) {
            log.debug("Abandoned {} call produced no result: {}", backend, e.toString());
        }
    }

    private static void release(String backend, Object result) {
        if (!(result instanceof ChunkStream stream)) return;
        try {
            stream.close();
            log.debug("Closed {} stream that arrived after its attempt timed out", backend);
        } catch (RuntimeException e) {
            log.warn("Failed to close abandoned {} stream", backend, e);
        }
    }

    private static BridgeException classify(RuntimeException e, RequestContext rc) {
        if (e instanceof BackendException be && be.backendKind() == BackendErrorKind.TIMEOUT) {
            return new DeadlineExceededException(rc.requestId(), rc.timeout(), be);
        }
        if (e instanceof BridgeException be) return be;
        return BridgeException.internal(e.getMessage(), e);
    }

    private static ChunkStream replay(ChatResponse response) {
        return ChunkStream.of(List.of(
                StreamChunk.delta(response.content()),
                StreamChunk.finish(response.finishReason(), response.usage())));
    }

    private Duration timeoutOf(DispatchOptions opts) {
        return opts.timeout() != null ? opts.timeout() : defaultTimeout;
    }

    private void ensureOpen() {
        if (closed) throw BridgeException.internal("Bridge is closed", null);
    }

    private static DispatchOutcome outcome(RequestContext rc) {
        return rc.attempt() > 1 ? DispatchOutcome.RETRIED_SUCCESS : DispatchOutcome.SUCCESS;
    }

    private void emitEnd(RequestContext rc, MiddlewareContext ctx, String backend, String model,
                         ChatResponse response, boolean streaming) {
        events.emit(new BridgeEvent(BridgeEvent.Type.REQUEST_END, rc.requestId(), backend, model, rc.elapsed(),
                response != null ? response.usage() : null, response != null ? response.finishReason() : null,
                null, rc.attempt(), outcome(rc), streaming,
                response != null && response.source() == ResponseSource.CACHE, failedOver(ctx), clock.instant()));
    }

    private void emitError(RequestContext rc, MiddlewareContext ctx, BridgeException error, boolean streaming) {
        var selection = ctx.get(StateKeys.SELECTION, Selection.class).orElse(null);
        emitError(rc, ctx, selection, ErrorInfo.from(error), streaming);
    }

    private void emitError(RequestContext rc, MiddlewareContext ctx, Selection selection, ErrorInfo error,
                           boolean streaming) {
        events.emit(new BridgeEvent(BridgeEvent.Type.REQUEST_ERROR, rc.requestId(),
                selection != null ? selection.backend() : null, selection != null ? selection.model() : null,
                rc.elapsed(), null, FinishReason.ERROR, error, rc.attempt(), DispatchOutcome.FAILED,
                streaming, false, failedOver(ctx), clock.instant()));
    }

    private class StreamObserver implements StreamTranslator.Observer {
        private final RequestContext rc;
        private final MiddlewareContext ctx;
        private final Selection selection;

        StreamObserver(RequestContext rc, MiddlewareContext ctx, Selection selection) {
            this.rc = rc;
            this.ctx = ctx;
            this.selection = selection;
        }

        @Override
        public void onTerminal(StreamChunk terminal) {
            if (terminal.finishReason() == FinishReason.ERROR) {
                if (selection != null) router.health().recordFailure(selection.backend());
                emitError(rc, ctx, selection, terminal.error(), true);
                return;
            }
            var backend = selection != null ? selection.backend() : null;
            var model = selection != null ? selection.model() : null;
            events.emit(new BridgeEvent(BridgeEvent.Type.REQUEST_END, rc.requestId(), backend, model,
                    rc.elapsed(), terminal.usage(), terminal.finishReason(), null, rc.attempt(), outcome(rc),
                    true, ctx.get(StateKeys.CACHE_HIT, Boolean.class).orElse(false), failedOver(ctx),
                    clock.instant()));
        }

        @Override
        public void onCancelled(long delivered) {
            rc.cancel();
        }
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, "llmbridge-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static class Builder {
        private final BackendRegistry registry;
        private Router router;
        private RoutingPolicy policy;
        private CapabilityFilter defaultFilter;
        private MiddlewarePipeline pipeline;
        private ExecutorService executor;
        private EventDispatcher events;
        private ModelCacheRegistry modelCaches;
        private Clock clock;
        private Duration defaultTimeout;

        private Builder(BackendRegistry registry) {
            this.registry = registry;
        }

        public Builder router(Router router) { this.router = router; return this; }
        public Builder policy(RoutingPolicy policy) { this.policy = policy; return this; }
        public Builder defaultFilter(CapabilityFilter filter) { this.defaultFilter = filter; return this; }
        public Builder pipeline(MiddlewarePipeline pipeline) { this.pipeline = pipeline; return this; }
        public Builder executor(ExecutorService executor) { this.executor = executor; return this; }
        public Builder events(EventDispatcher events) { this.events = events; return this; }
        public Builder modelCaches(ModelCacheRegistry caches) { this.modelCaches = caches; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder defaultTimeout(Duration timeout) { this.defaultTimeout = timeout; return this; }

        public Bridge build() {
            if (registry == null) throw new IllegalStateException("registry is required");
            return new Bridge(this);
        }
    }
}
