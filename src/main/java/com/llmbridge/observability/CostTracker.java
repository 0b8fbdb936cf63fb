package com.llmbridge.observability;

import com.llmbridge.shared.model.Usage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

public class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    private static final int MAX_REMEMBERED_IDS = 10_000;

    public record Pricing(double inputPer1k, double outputPer1k) {}

    public record Summary(long requests, long promptTokens, long completionTokens,
                          double totalCost, Map<String, Double> costByBackend) {}

    // USD per 1K tokens
    static final Map<String, Pricing> MODEL_PRICING = Map.of(
            "gpt-4o", new Pricing(0.0025, 0.01),
            "gpt-4o-mini", new Pricing(0.00015, 0.0006),
            "gpt-3.5-turbo", new Pricing(0.0005, 0.0015),
            "claude-3-5-sonnet-20241022", new Pricing(0.003, 0.015),
            "claude-3-5-haiku-20241022", new Pricing(0.0008, 0.004),
            "claude-3-opus-20240229", new Pricing(0.015, 0.075),
            "deepseek-chat", new Pricing(0.00014, 0.00028)
    );

    private final Map<String, Double> backendRates;
    private final Set<String> charged = Collections.newSetFromMap(new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > MAX_REMEMBERED_IDS;
        }
    });
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong promptTokens = new AtomicLong();
    private final AtomicLong completionTokens = new AtomicLong();
    private final DoubleAdder total = new DoubleAdder();
    private final ConcurrentHashMap<String, DoubleAdder> byBackend = new ConcurrentHashMap<>();

    public CostTracker(Map<String, Double> backendRates) {
        this.backendRates = backendRates != null ? Map.copyOf(backendRates) : Map.of();
    }

    public double cost(String backend, String model, Usage usage) {
        var pricing = model != null ? MODEL_PRICING.get(model) : null;
        if (pricing != null) {
            return usage.promptTokens() / 1000.0 * pricing.inputPer1k()
                    + usage.completionTokens() / 1000.0 * pricing.outputPer1k();
        }
        return usage.totalTokens() / 1000.0 * backendRates.getOrDefault(backend, 0.0);
    }

    public boolean record(String requestId, String backend, String model, Usage usage) {
        synchronized (charged) {
            if (!charged.add(requestId)) {
                log.debug("Ignoring duplicate cost record for request {}", requestId);
                return false;
            }
        }
        var cost = cost(backend, model, usage);
        requests.incrementAndGet();
        promptTokens.addAndGet(usage.promptTokens());
        completionTokens.addAndGet(usage.completionTokens());
        total.add(cost);
        byBackend.computeIfAbsent(backend != null ? backend : "unknown", k -> new DoubleAdder()).add(cost);
        log.debug("Request {} cost ${} on {}/{}", requestId, String.format("%.6f", cost), backend, model);
        return true;
    }

    public Summary summary() {
        var perBackend = new LinkedHashMap<String, Double>();
        byBackend.forEach((k, v) -> perBackend.put(k, v.sum()));
        return new Summary(requests.get(), promptTokens.get(), completionTokens.get(), total.sum(),
                Map.copyOf(perBackend));
    }

    public void reset() {
        synchronized (charged) {
            charged.clear();
        }
        requests.set(0);
        promptTokens.set(0);
        completionTokens.set(0);
        total.reset();
        byBackend.clear();
    }
}
