package com.llmbridge.gateway;

import com.llmbridge.providers.MockBackend;
import com.llmbridge.providers.OllamaBackend;
import com.llmbridge.routing.CapabilityFilter;
import com.llmbridge.routing.CostTier;
import com.llmbridge.shared.config.BridgeConfig;
import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.Message;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BridgeAssemblerTest {

    private static BridgeConfig.BackendConfig mock(String defaultModel, double cost) {
        return new BridgeConfig.BackendConfig("mock", null, null, defaultModel, List.of(), cost, 30);
    }

    private static BridgeConfig config(Map<String, BridgeConfig.BackendConfig> backends) {
        var d = BridgeConfig.defaults();
        return new BridgeConfig(d.timeoutMs(), d.cache(), d.retry(), d.rateLimit(), d.routing(),
            d.observability(), d.security(), backends);
    }

    @Test
    void assemblesWorkingBridgeFromConfig() {
        var backends = new LinkedHashMap<String, BridgeConfig.BackendConfig>();
        backends.put("primary", mock("echo-1", 0.0));
        backends.put("secondary", mock("echo-2", 0.001));
        var assembler = new BridgeAssembler(config(backends));

        try (var bridge = assembler.assemble()) {
            assertEquals(List.of("primary", "secondary"), bridge.registry().names());

            var response = bridge.dispatch(ChatRequest.of(List.of(Message.user("hello"))));

            assertEquals("Mock response to: hello", response.content());
            assertEquals("primary", response.backend());
            assertEquals(1, assembler.costTracker().summary().requests());
        }
    }

    @Test
    void mockBackendTakesStaticModelsFromConfig() {
        var assembler = new BridgeAssembler(BridgeConfig.defaults());
        var bc = new BridgeConfig.BackendConfig("mock", null, null, null, List.of("a", "b"), 0, 30);

        var backend = assembler.backend("fake", bc, null);

        assertInstanceOf(MockBackend.class, backend);
        assertEquals("mock-model", backend.metadata().defaultModel());
        assertTrue(backend.listModels(null).contains("b"));
    }

    @Test
    void typeDefaultsToBackendName() {
        var assembler = new BridgeAssembler(BridgeConfig.defaults());
        var bc = new BridgeConfig.BackendConfig(null, null, null, null, List.of(), 0, 0);

        assertInstanceOf(OllamaBackend.class, assembler.backend("ollama", bc, null));
    }

    @Test
    void unknownTypeIsRejected() {
        var assembler = new BridgeAssembler(BridgeConfig.defaults());
        var bc = new BridgeConfig.BackendConfig("cohere", null, null, null, List.of(), 0, 30);

        assertThrows(IllegalArgumentException.class, () -> assembler.backend("x", bc, null));
    }

    @Test
    void noTiersMeansNoPolicy() {
        assertNull(BridgeAssembler.policy(BridgeConfig.RoutingConfig.defaults(), Map.of()));
    }

    @Test
    void tiersBecomeRoutingPolicy() {
        var routing = new BridgeConfig.RoutingConfig(
            Map.of("simple", List.of("local"), "complex", List.of("openai/gpt-4o")),
            20, 80, BridgeConfig.FilterConfig.defaults());

        var policy = BridgeAssembler.policy(routing, Map.of("openai", 0.005));

        assertNotNull(policy);
        assertEquals(List.of("local"), policy.preferencesFor(CostTier.SIMPLE));
        assertEquals(List.of("openai/gpt-4o"), policy.preferencesFor(CostTier.COMPLEX));
        assertEquals(20, policy.moderateThreshold());
        assertEquals(0.005, policy.costOverrides().get("openai"));
    }

    @Test
    void filterFromConfig() {
        assertSame(CapabilityFilter.NONE, BridgeAssembler.filter(null));

        var filter = BridgeAssembler.filter(new BridgeConfig.FilterConfig(true, false, true, false, 8000));

        assertTrue(filter.streaming());
        assertTrue(filter.tools());
        assertFalse(filter.vision());
        assertEquals(8000, filter.minContextTokens());
    }
}
