package com.llmbridge.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".llmbridge", "config.yaml"
    );

    public static BridgeConfig load() {
        return load(DEFAULT_PATH);
    }

    public static BridgeConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    public static BridgeConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var defaults = BridgeConfig.defaults();
        var cache = (Map<String, Object>) raw.getOrDefault("cache", Map.of());
        var retry = (Map<String, Object>) raw.getOrDefault("retry", Map.of());
        var rateLimit = (Map<String, Object>) raw.getOrDefault("rate-limit", Map.of());
        var routing = (Map<String, Object>) raw.getOrDefault("routing", Map.of());
        var observability = (Map<String, Object>) raw.getOrDefault("observability", Map.of());
        var security = (Map<String, Object>) raw.getOrDefault("security", Map.of());
        var backends = (Map<String, Map<String, Object>>) raw.getOrDefault("backends", Map.of());

        return new BridgeConfig(
            Long.parseLong(envOrDefault(env, "LLMBRIDGE_TIMEOUT_MS",
                String.valueOf(raw.getOrDefault("timeout-ms", defaults.timeoutMs())))),
            parseCache(cache, env),
            parseRetry(retry),
            parseRateLimit(rateLimit),
            parseRouting(routing),
            new BridgeConfig.ObservabilityConfig(
                Double.parseDouble(String.valueOf(observability.getOrDefault("sampling-rate",
                    defaults.observability().samplingRate())))),
            new BridgeConfig.SecurityConfig(
                bool(security, "block-injection", defaults.security().blockInjection()),
                bool(security, "redact-pii", defaults.security().redactPii())),
            parseBackends(backends, env)
        );
    }

    private static BridgeConfig.CacheConfig parseCache(Map<String, Object> cache, Function<String, String> env) {
        var def = BridgeConfig.CacheConfig.defaults();
        return new BridgeConfig.CacheConfig(
            Long.parseLong(String.valueOf(cache.getOrDefault("model-ttl-seconds", def.modelTtlSeconds()))),
            envOrDefault(env, "LLMBRIDGE_CACHE_SCOPE", String.valueOf(cache.getOrDefault("scope", def.scope()))),
            Long.parseLong(String.valueOf(cache.getOrDefault("response-ttl-seconds", def.responseTtlSeconds()))),
            Integer.parseInt(String.valueOf(cache.getOrDefault("response-max-entries", def.responseMaxEntries()))),
            bool(cache, "response-enabled", def.responseEnabled())
        );
    }

    private static BridgeConfig.RetryConfig parseRetry(Map<String, Object> retry) {
        var def = BridgeConfig.RetryConfig.defaults();
        return new BridgeConfig.RetryConfig(
            Integer.parseInt(String.valueOf(retry.getOrDefault("max-attempts", def.maxAttempts()))),
            Long.parseLong(String.valueOf(retry.getOrDefault("base-delay-ms", def.baseDelayMs()))),
            Long.parseLong(String.valueOf(retry.getOrDefault("max-delay-ms", def.maxDelayMs()))),
            Double.parseDouble(String.valueOf(retry.getOrDefault("jitter-min", def.jitterMin()))),
            Double.parseDouble(String.valueOf(retry.getOrDefault("jitter-max", def.jitterMax())))
        );
    }

    private static BridgeConfig.RateLimitConfig parseRateLimit(Map<String, Object> rateLimit) {
        var def = BridgeConfig.RateLimitConfig.defaults();
        return new BridgeConfig.RateLimitConfig(
            bool(rateLimit, "enabled", def.enabled()),
            Integer.parseInt(String.valueOf(rateLimit.getOrDefault("max-requests", def.maxRequests()))),
            Long.parseLong(String.valueOf(rateLimit.getOrDefault("window-seconds", def.windowSeconds())))
        );
    }

    @SuppressWarnings("unchecked")
    private static BridgeConfig.RoutingConfig parseRouting(Map<String, Object> routing) {
        var def = BridgeConfig.RoutingConfig.defaults();
        var rawTiers = (Map<String, List<?>>) routing.getOrDefault("tiers", Map.of());
        var tiers = new LinkedHashMap<String, List<String>>();
        rawTiers.forEach((tier, names) -> tiers.put(tier, names.stream().map(String::valueOf).toList()));

        var filter = (Map<String, Object>) routing.getOrDefault("default-filter", Map.of());
        return new BridgeConfig.RoutingConfig(
            tiers,
            Integer.parseInt(String.valueOf(routing.getOrDefault("moderate-threshold", def.moderateThreshold()))),
            Integer.parseInt(String.valueOf(routing.getOrDefault("complex-threshold", def.complexThreshold()))),
            new BridgeConfig.FilterConfig(
                bool(filter, "streaming", false),
                bool(filter, "vision", false),
                bool(filter, "tools", false),
                bool(filter, "json-mode", false),
                Integer.parseInt(String.valueOf(filter.getOrDefault("min-context", 0))))
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, BridgeConfig.BackendConfig> parseBackends(
            Map<String, Map<String, Object>> backends, Function<String, String> env) {
        var out = new LinkedHashMap<String, BridgeConfig.BackendConfig>();
        backends.forEach((name, b) -> {
            var keyEnv = "LLMBRIDGE_" + name.toUpperCase().replace('-', '_') + "_API_KEY";
            var apiKey = b.get("api-key") != null ? String.valueOf(b.get("api-key")) : null;
            var models = (List<?>) b.getOrDefault("models", List.of());
            out.put(name, new BridgeConfig.BackendConfig(
                String.valueOf(b.getOrDefault("type", name)),
                (String) b.get("base-url"),
                envOrDefault(env, keyEnv, apiKey),
                (String) b.get("default-model"),
                models.stream().map(String::valueOf).toList(),
                Double.parseDouble(String.valueOf(b.getOrDefault("cost-per-1k-tokens", 0.0))),
                Long.parseLong(String.valueOf(b.getOrDefault("timeout-seconds", 30)))
            ));
        });
        return out;
    }

    private static boolean bool(Map<String, Object> section, String key, boolean fallback) {
        var value = section.get(key);
        return value == null ? fallback : Boolean.parseBoolean(String.valueOf(value));
    }

    private static String envOrDefault(Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
