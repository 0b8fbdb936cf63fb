package com.llmbridge.routing;

import com.llmbridge.shared.model.ChatRequest;
import com.llmbridge.shared.model.ContentPart;
import com.llmbridge.shared.model.GenerationParams;
import com.llmbridge.shared.model.Message;
import com.llmbridge.shared.model.Role;
import com.llmbridge.shared.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RoutingPolicyTest {

    private final HeuristicComplexityScorer scorer = new HeuristicComplexityScorer();

    @Test
    void shortPromptIsSimple() {
        var request = ChatRequest.of(List.of(Message.user("What is 2+2?")));
        assertEquals(0, scorer.score(request));
        assertEquals(CostTier.SIMPLE, RoutingPolicy.of(Map.of()).tierFor(request));
    }

    @Test
    void largeToolUsingConversationIsComplex() {
        var messages = new ArrayList<Message>();
        for (int i = 0; i < 12; i++) {
            messages.add(Message.user("x".repeat(2_000)));
        }
        var tool = new ToolDefinition("search", null, Map.of());
        var request = new ChatRequest(null, messages, null,
                GenerationParams.defaults().withMaxTokens(4_000).withJsonMode(true), List.of(tool), false, null);

        int score = scorer.score(request);

        assertTrue(score >= 70, "score was " + score);
        assertEquals(CostTier.COMPLEX, RoutingPolicy.of(Map.of()).tierFor(request));
    }

    @Test
    void scoreIsCappedAt100() {
        var messages = new ArrayList<Message>();
        for (int i = 0; i < 50; i++) messages.add(Message.user("y".repeat(10_000)));
        messages.add(new Message(Role.USER, List.of(ContentPart.image("https://example.com/chart.png"))));
        var request = new ChatRequest(null, messages, null,
                GenerationParams.defaults().withMaxTokens(100_000).withJsonMode(true),
                List.of(new ToolDefinition("t", null, Map.of())), false, null);

        assertEquals(100, scorer.score(request));
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThrows(IllegalArgumentException.class,
                () -> new RoutingPolicy(null, 80, 20, Map.of(), Map.of()));
    }

    @Test
    void customScorerDrivesTier() {
        var policy = new RoutingPolicy(r -> 50, 30, 70, Map.of(CostTier.MODERATE, List.of("mid")), Map.of());
        var request = ChatRequest.of(List.of(Message.user("hi")));

        assertEquals(CostTier.MODERATE, policy.tierFor(request));
        assertEquals(List.of("mid"), policy.preferencesFor(CostTier.MODERATE));
        assertTrue(policy.preferencesFor(CostTier.COMPLEX).isEmpty());
    }
}
