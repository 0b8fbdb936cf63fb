package com.llmbridge.shared.config;

import java.util.List;
import java.util.Map;

public record BridgeConfig(
    long timeoutMs,
    CacheConfig cache,
    RetryConfig retry,
    RateLimitConfig rateLimit,
    RoutingConfig routing,
    ObservabilityConfig observability,
    SecurityConfig security,
    Map<String, BackendConfig> backends
) {
    public record CacheConfig(long modelTtlSeconds, String scope, long responseTtlSeconds,
                              int responseMaxEntries, boolean responseEnabled) {
        public static CacheConfig defaults() {
            return new CacheConfig(3600, "process", 3600, 1000, true);
        }
    }

    public record RetryConfig(int maxAttempts, long baseDelayMs, long maxDelayMs,
                              double jitterMin, double jitterMax) {
        public static RetryConfig defaults() {
            return new RetryConfig(3, 500, 10_000, 0.5, 1.0);
        }
    }

    public record RateLimitConfig(boolean enabled, int maxRequests, long windowSeconds) {
        public static RateLimitConfig defaults() {
            return new RateLimitConfig(false, 60, 60);
        }
    }

    public record FilterConfig(boolean streaming, boolean vision, boolean tools, boolean jsonMode, int minContext) {
        public static FilterConfig defaults() {
            return new FilterConfig(false, false, false, false, 0);
        }
    }

    public record RoutingConfig(Map<String, List<String>> tiers, int moderateThreshold,
                                int complexThreshold, FilterConfig defaultFilter) {
        public static RoutingConfig defaults() {
            return new RoutingConfig(Map.of(), 30, 70, FilterConfig.defaults());
        }
    }

    public record ObservabilityConfig(double samplingRate) {
        public static ObservabilityConfig defaults() {
            return new ObservabilityConfig(1.0);
        }
    }

    public record SecurityConfig(boolean blockInjection, boolean redactPii) {
        public static SecurityConfig defaults() {
            return new SecurityConfig(true, false);
        }
    }

    public record BackendConfig(String type, String baseUrl, String apiKey, String defaultModel,
                                List<String> models, double costPer1kTokens, long timeoutSeconds) {}

    public static BridgeConfig defaults() {
        return new BridgeConfig(
            30_000,
            CacheConfig.defaults(),
            RetryConfig.defaults(),
            RateLimitConfig.defaults(),
            RoutingConfig.defaults(),
            ObservabilityConfig.defaults(),
            SecurityConfig.defaults(),
            Map.of()
        );
    }
}
