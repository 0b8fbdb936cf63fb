package com.llmbridge.cache;

import com.llmbridge.providers.ListModelsOptions;
import com.llmbridge.providers.ListModelsResult;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.Capabilities;
import com.llmbridge.shared.model.ModelSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The catalog lookup order every adapter follows:
 * <ol>
 *   <li>static override from config (bypasses cache and network)</li>
 *   <li>fresh cache entry, unless a refresh is forced</li>
 *   <li>live fetch, written through to the cache as REMOTE</li>
 *   <li>on fetch failure: last cached entry as STALE, else the bundled defaults as STATIC</li>
 * </ol>
 * {@link #resolve} never throws.
 */
public class CatalogResolver {

    private static final Logger log = LoggerFactory.getLogger(CatalogResolver.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    @FunctionalInterface
    public interface RemoteFetcher {
        List<AIModel> fetch() throws Exception;
    }

    private final String adapterName;
    private final ModelCache cache;
    private final List<AIModel> staticOverride;
    private final List<AIModel> defaults;
    private final Duration ttl;
    private final Clock clock;

    public CatalogResolver(String adapterName, ModelCache cache, List<AIModel> staticOverride,
                           List<AIModel> defaults, Duration ttl, Clock clock) {
        this.adapterName = adapterName;
        this.cache = cache;
        this.staticOverride = staticOverride != null && !staticOverride.isEmpty() ? List.copyOf(staticOverride) : null;
        this.defaults = defaults != null ? List.copyOf(defaults) : List.of();
        this.ttl = ttl != null ? ttl : DEFAULT_TTL;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public ListModelsResult resolve(ListModelsOptions options, RemoteFetcher fetcher, Capabilities adapterCaps) {
        var opts = options != null ? options : ListModelsOptions.defaults();
        return lookup(opts, fetcher).filter(opts.filter(), adapterCaps);
    }

    private ListModelsResult lookup(ListModelsOptions opts, RemoteFetcher fetcher) {
        if (staticOverride != null) {
            return new ListModelsResult(staticOverride, ModelSource.STATIC, clock.instant(), true);
        }
        if (!opts.forceRefresh()) {
            var cached = cacheGet();
            if (cached.isPresent()) return toResult(cached.get());
        }
        if (fetcher != null) {
            try {
                var models = fetcher.fetch();
                var entry = new ModelCacheEntry(models, ModelSource.REMOTE, clock.instant(), true);
                cachePut(entry);
                return toResult(entry);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Model listing for {} interrupted", adapterName);
            } catch (Exception e) {
                log.warn("Model listing for {} failed, falling back: {}", adapterName, e.getMessage());
            }
            var stale = cachePeek();
            if (stale.isPresent()) return toResult(stale.get().asStale());
        }
        return new ListModelsResult(defaults, ModelSource.STATIC, clock.instant(), !defaults.isEmpty());
    }

    private Optional<ModelCacheEntry> cacheGet() {
        if (cache == null) return Optional.empty();
        try {
            return cache.get(adapterName);
        } catch (RuntimeException e) {
            log.warn("Model cache read failed for {}: {}", adapterName, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ModelCacheEntry> cachePeek() {
        if (cache == null) return Optional.empty();
        try {
            return cache.peek(adapterName);
        } catch (RuntimeException e) {
            log.warn("Model cache read failed for {}: {}", adapterName, e.getMessage());
            return Optional.empty();
        }
    }

    private void cachePut(ModelCacheEntry entry) {
        if (cache == null) return;
        try {
            cache.set(adapterName, entry, ttl);
        } catch (RuntimeException e) {
            log.warn("Model cache write failed for {}: {}", adapterName, e.getMessage());
        }
    }

    private static ListModelsResult toResult(ModelCacheEntry entry) {
        return new ListModelsResult(entry.models(), entry.source(), entry.fetchedAt(), entry.complete());
    }
}
