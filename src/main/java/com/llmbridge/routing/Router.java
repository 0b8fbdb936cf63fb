package com.llmbridge.routing;

import com.llmbridge.errors.NoCandidateException;
import com.llmbridge.shared.model.AIModel;
import com.llmbridge.shared.model.ChatRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Picks one (backend, model) pair. Pairs whose capabilities fail the filter and backends whose
 * circuit is open are pruned first; a routing policy can then only choose among survivors, so a
 * capability requirement is never traded away for cost.
 */
public class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private record Pair(int order, Candidate candidate, AIModel model) {
        boolean isDefaultModel() {
            return model.id().equals(candidate.metadata().defaultModel());
        }
    }

    private final BackendHealth health;

    public Router() {
        this(new BackendHealth());
    }

    public Router(BackendHealth health) {
        this.health = health;
    }

    public BackendHealth health() {
        return health;
    }

    public Selection select(List<Candidate> candidates, CapabilityFilter filter,
                            RoutingPolicy policy, ChatRequest request) {
        var f = filter != null ? filter : CapabilityFilter.NONE;
        var pinned = request.model();
        var pairs = survivors(candidates, f, pinned);
        if (pairs.isEmpty()) {
            var names = candidates.stream().map(Candidate::name).toList();
            throw new NoCandidateException("No backend satisfies [" + f.describe() + "]"
                    + (pinned != null ? " for model " + pinned : "") + " among " + names);
        }

        CostTier tier = policy != null ? policy.tierFor(request) : null;
        if (policy != null) {
            for (var pref : policy.preferencesFor(tier)) {
                var match = matchPreference(pairs, pref);
                if (match != null) {
                    log.debug("Request {} tier={} routed by preference {}", request.id(), tier, pref);
                    return new Selection(match.candidate().name(), match.model().id(), tier,
                            "tier " + tier.name().toLowerCase() + " preference " + pref);
                }
            }
        }

        Map<String, Double> overrides = policy != null ? policy.costOverrides() : Map.of();
        var best = pairs.stream()
                .min(Comparator.<Pair>comparingDouble(p -> overrides.getOrDefault(
                                p.candidate().name(), p.candidate().metadata().costPer1kTokens()))
                        .thenComparingInt(Pair::order)
                        .thenComparing(p -> !p.isDefaultModel()))
                .orElseThrow();
        return new Selection(best.candidate().name(), best.model().id(), tier, "lowest cost");
    }

    private List<Pair> survivors(List<Candidate> candidates, CapabilityFilter filter, String pinned) {
        boolean pinnedListed = pinned != null && candidates.stream()
                .anyMatch(c -> c.models().stream().anyMatch(m -> m.id().equals(pinned)));
        var pairs = new ArrayList<Pair>();
        for (int i = 0; i < candidates.size(); i++) {
            var c = candidates.get(i);
            if (health != null && !health.isAvailable(c.name())) {
                log.debug("Skipping unhealthy backend {}", c.name());
                continue;
            }
            var adapterCaps = c.metadata().capabilities();
            for (var model : modelsOf(c, pinned, pinnedListed)) {
                if (filter.test(model.effectiveCapabilities(adapterCaps))) {
                    pairs.add(new Pair(i, c, model));
                }
            }
        }
        return pairs;
    }

    private static List<AIModel> modelsOf(Candidate c, String pinned, boolean pinnedListed) {
        if (pinned != null) {
            // a model no catalog knows is assumed to inherit each adapter's capabilities
            if (!pinnedListed) return List.of(AIModel.of(pinned));
            return c.models().stream().filter(m -> m.id().equals(pinned)).toList();
        }
        if (c.models().isEmpty() && c.metadata().defaultModel() != null) {
            return List.of(AIModel.of(c.metadata().defaultModel()));
        }
        return c.models();
    }

    private static Pair matchPreference(List<Pair> pairs, String pref) {
        var slash = pref.indexOf('/');
        var backend = slash < 0 ? pref : pref.substring(0, slash);
        var model = slash < 0 ? null : pref.substring(slash + 1);
        Pair first = null;
        for (var p : pairs) {
            if (!p.candidate().name().equals(backend)) continue;
            if (model != null && !p.model().id().equals(model)) continue;
            if (p.isDefaultModel()) return p;
            if (first == null) first = p;
        }
        return first;
    }
}
