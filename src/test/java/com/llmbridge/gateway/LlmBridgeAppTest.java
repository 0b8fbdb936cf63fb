package com.llmbridge.gateway;

import com.llmbridge.bridge.Bridge;
import com.llmbridge.errors.BackendErrorKind;
import com.llmbridge.errors.BackendException;
import com.llmbridge.providers.BackendRegistry;
import com.llmbridge.providers.MockBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LlmBridgeAppTest {

    private static final String OPENAI_BODY = """
        {"messages": [{"role": "user", "content": "hi"}]}
        """;

    private MockBackend backend;
    private Bridge bridge;
    private LlmBridgeApp app;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() {
        backend = MockBackend.builder("mock").defaultModel("mock-1").build();
        bridge = Bridge.builder(new BackendRegistry().register(backend)).build();
        app = new LlmBridgeApp(bridge);
    }

    @AfterEach
    void tearDown() {
        bridge.close();
    }

    private int run(String stdin, String... args) {
        return app.run(args, new StringReader(stdin),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(2, run(""));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void unknownCommand() {
        assertEquals(2, run("", "serve"));
        assertTrue(err().contains("Unknown command: serve"));
    }

    @Test
    void listsBackends() {
        assertEquals(0, run("", "backends"));
        assertEquals("mock", out().trim());
    }

    @Test
    void listsModels() {
        assertEquals(0, run("", "models", "mock"));

        var lines = out().trim().split("\\R");
        assertEquals("# source=static complete=true", lines[0]);
        assertEquals("mock-1", lines[1]);
    }

    @Test
    void modelsNeedsBackendName() {
        assertEquals(2, run("", "models", "--refresh"));
        assertTrue(err().contains("Missing value for BACKEND"));
    }

    @Test
    void modelsForUnknownBackendFails() {
        assertEquals(1, run("", "models", "nope"));
        assertTrue(err().startsWith("no_candidate:"));
    }

    @Test
    void chatFromStdin() {
        assertEquals(0, run(OPENAI_BODY, "chat"));

        assertTrue(out().contains("Mock response to: hi"));
        assertTrue(out().contains("chat.completion"));
    }

    @Test
    void chatStreamsServerSentEvents() {
        assertEquals(0, run(OPENAI_BODY, "chat", "--stream", "-"));

        assertTrue(out().contains("data: {"));
        assertTrue(out().trim().endsWith("data: [DONE]"));
    }

    @Test
    void chatWithAnthropicDialect() {
        var body = """
            {"max_tokens": 64, "messages": [{"role": "user", "content": "hi"}]}
            """;

        assertEquals(0, run(body, "chat", "--frontend", "anthropic"));

        assertTrue(out().contains("\"type\" : \"message\""));
    }

    @Test
    void unknownFrontend() {
        assertEquals(2, run(OPENAI_BODY, "chat", "--frontend", "gemini"));
        assertTrue(err().contains("Unknown frontend: gemini"));
    }

    @Test
    void invalidJsonIsValidationError() {
        assertEquals(1, run("{not json", "chat"));
        assertTrue(err().startsWith("validation:"));
    }

    @Test
    void backendFailureIsRenderedInWireFormat() {
        backend.failWith(new BackendException(BackendErrorKind.AUTH, "mock", "bad key"));

        assertEquals(1, run(OPENAI_BODY, "chat"));

        assertTrue(out().contains("\"error\""));
        assertEquals(1, backend.callCount());
    }
}
