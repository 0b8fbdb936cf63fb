package com.llmbridge.gateway;

import com.llmbridge.bridge.Bridge;
import com.llmbridge.cache.InMemoryResponseCache;
import com.llmbridge.cache.ModelCache;
import com.llmbridge.cache.ModelCacheRegistry;
import com.llmbridge.cache.RequestFingerprinter;
import com.llmbridge.middleware.CachingMiddleware;
import com.llmbridge.middleware.CostTrackingMiddleware;
import com.llmbridge.middleware.FailoverMiddleware;
import com.llmbridge.middleware.LoggingMiddleware;
import com.llmbridge.middleware.MiddlewarePipeline;
import com.llmbridge.middleware.RateLimitMiddleware;
import com.llmbridge.middleware.RetryMiddleware;
import com.llmbridge.middleware.RetryPolicy;
import com.llmbridge.middleware.SecurityMiddleware;
import com.llmbridge.middleware.SlidingWindowRateLimiter;
import com.llmbridge.middleware.ValidationMiddleware;
import com.llmbridge.observability.BridgeMetrics;
import com.llmbridge.observability.CostTracker;
import com.llmbridge.observability.EventDispatcher;
import com.llmbridge.providers.AnthropicBackend;
import com.llmbridge.providers.BackendAdapter;
import com.llmbridge.providers.BackendRegistry;
import com.llmbridge.providers.BackendSettings;
import com.llmbridge.providers.DeepSeekBackend;
import com.llmbridge.providers.MockBackend;
import com.llmbridge.providers.OllamaBackend;
import com.llmbridge.providers.OpenAiBackend;
import com.llmbridge.providers.OpenAiCompatibleBackend;
import com.llmbridge.routing.CapabilityFilter;
import com.llmbridge.routing.CostTier;
import com.llmbridge.routing.HeuristicComplexityScorer;
import com.llmbridge.routing.RoutingPolicy;
import com.llmbridge.shared.config.BridgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;

public class BridgeAssembler {

    private static final Logger log = LoggerFactory.getLogger(BridgeAssembler.class);

    private final BridgeConfig config;
    private final HttpClient httpClient;
    private final BridgeMetrics metrics = new BridgeMetrics();
    private CostTracker costTracker;

    public BridgeAssembler(BridgeConfig config) {
        this(config, OpenAiCompatibleBackend.defaultClient());
    }

    public BridgeAssembler(BridgeConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    public BridgeMetrics metrics() {
        return metrics;
    }

    public CostTracker costTracker() {
        return costTracker;
    }

    public Bridge assemble() {
        var caches = new ModelCacheRegistry();
        var modelCache = caches.forScope(config.cache().scope());

        var registry = new BackendRegistry();
        var rates = new LinkedHashMap<String, Double>();
        config.backends().forEach((name, backendConfig) -> {
            registry.register(backend(name, backendConfig, modelCache));
            if (backendConfig.costPer1kTokens() > 0) rates.put(name, backendConfig.costPer1kTokens());
            log.info("Registered backend {} ({})", name, backendConfig.type());
        });
        if (registry.isEmpty()) {
            log.warn("No backends configured. Add a backends section to ~/.llmbridge/config.yaml");
        }
        costTracker = new CostTracker(rates);

        var events = new EventDispatcher(Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "llmbridge-events");
            t.setDaemon(true);
            return t;
        }), config.observability().samplingRate());
        events.addListener(metrics);

        var builder = Bridge.builder(registry)
            .pipeline(pipeline())
            .defaultFilter(filter(config.routing().defaultFilter()))
            .events(events)
            .modelCaches(caches)
            .defaultTimeout(Duration.ofMillis(config.timeoutMs()));
        var policy = policy(config.routing(), rates);
        if (policy != null) builder.policy(policy);
        return builder.build();
    }

    MiddlewarePipeline pipeline() {
        var security = config.security();
        var pipeline = MiddlewarePipeline.builder()
            .use(new LoggingMiddleware())
            .use(new ValidationMiddleware())
            .use(new SecurityMiddleware(security.blockInjection(), security.redactPii()));

        var rateLimit = config.rateLimit();
        if (rateLimit.enabled()) {
            pipeline.use(new RateLimitMiddleware(new SlidingWindowRateLimiter(
                rateLimit.maxRequests(), Duration.ofSeconds(rateLimit.windowSeconds()))));
        }

        var cache = config.cache();
        if (cache.responseEnabled()) {
            pipeline.use(new CachingMiddleware(new InMemoryResponseCache(cache.responseMaxEntries()),
                new RequestFingerprinter(), Duration.ofSeconds(cache.responseTtlSeconds())));
        }

        var retry = config.retry();
        return pipeline
            .use(new CostTrackingMiddleware(costTracker))
            .use(new FailoverMiddleware())
            .use(new RetryMiddleware(new RetryPolicy(retry.maxAttempts(),
                Duration.ofMillis(retry.baseDelayMs()), Duration.ofMillis(retry.maxDelayMs()),
                2.0, retry.jitterMin(), retry.jitterMax())))
            .build();
    }

    BackendAdapter backend(String name, BridgeConfig.BackendConfig bc, ModelCache cache) {
        var settings = new BackendSettings(name, bc.baseUrl(), bc.apiKey(), bc.defaultModel(),
            bc.models(), bc.costPer1kTokens(),
            bc.timeoutSeconds() > 0 ? Duration.ofSeconds(bc.timeoutSeconds()) : null,
            Duration.ofSeconds(config.cache().modelTtlSeconds()));
        var type = bc.type() != null ? bc.type().toLowerCase(Locale.ROOT) : name;
        return switch (type) {
            case "openai" -> new OpenAiBackend(settings, httpClient, cache);
            case "deepseek" -> new DeepSeekBackend(settings, httpClient, cache);
            case "ollama" -> new OllamaBackend(settings, httpClient, cache);
            case "anthropic" -> new AnthropicBackend(settings, httpClient, cache);
            case "mock" -> MockBackend.builder(name)
                .defaultModel(bc.defaultModel() != null ? bc.defaultModel() : "mock-model")
                .cost(bc.costPer1kTokens())
                .staticModels(bc.models() != null ? bc.models() : List.of())
                .modelCache(cache)
                .build();
            default -> throw new IllegalArgumentException("Unknown backend type '" + bc.type() + "' for " + name);
        };
    }

    static CapabilityFilter filter(BridgeConfig.FilterConfig fc) {
        if (fc == null) return CapabilityFilter.NONE;
        return new CapabilityFilter(fc.streaming(), fc.vision(), fc.tools(), fc.jsonMode(), fc.minContext());
    }

    static RoutingPolicy policy(BridgeConfig.RoutingConfig routing, Map<String, Double> rates) {
        if (routing.tiers() == null || routing.tiers().isEmpty()) return null;
        var preferences = new EnumMap<CostTier, List<String>>(CostTier.class);
        routing.tiers().forEach((tier, backends) ->
            preferences.put(CostTier.valueOf(tier.toUpperCase(Locale.ROOT)), backends));
        return new RoutingPolicy(new HeuristicComplexityScorer(), routing.moderateThreshold(),
            routing.complexThreshold(), preferences, rates);
    }
}
