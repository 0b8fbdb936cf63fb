package com.llmbridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<BridgeEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Executor executor;
    private final double samplingRate;

    public EventDispatcher(Executor executor, double samplingRate) {
        if (samplingRate < 0 || samplingRate > 1) {
            throw new IllegalArgumentException("samplingRate must be within [0, 1]");
        }
        this.executor = executor;
        this.samplingRate = samplingRate;
    }

    public static EventDispatcher direct() {
        return new EventDispatcher(Runnable::run, 1.0);
    }

    public void addListener(BridgeEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(BridgeEventListener listener) {
        listeners.remove(listener);
    }

    public boolean isSampled(String requestId) {
        if (samplingRate >= 1.0) return true;
        if (samplingRate <= 0.0) return false;
        int bucket = Math.floorMod(requestId.hashCode(), 10_000);
        return bucket < samplingRate * 10_000;
    }

    public void emit(BridgeEvent event) {
        if (listeners.isEmpty()) return;
        if (!event.isError() && !isSampled(event.requestId())) return;
        for (var listener : listeners) {
            try {
                executor.execute(() -> deliver(listener, event));
            } catch (RejectedExecutionException e) {
                log.warn("Dropped {} event for {}: executor rejected delivery", event.type(), event.requestId());
            }
        }
    }

    private static void deliver(BridgeEventListener listener, BridgeEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Event listener {} failed on {}: {}",
                    listener.getClass().getSimpleName(), event.type(), e.getMessage());
        }
    }
}
