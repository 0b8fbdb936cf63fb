package com.llmbridge.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmbridge.bridge.Bridge;
import com.llmbridge.bridge.DispatchOptions;
import com.llmbridge.errors.BridgeException;
import com.llmbridge.errors.ValidationException;
import com.llmbridge.frontend.AnthropicFrontend;
import com.llmbridge.frontend.FrontendAdapter;
import com.llmbridge.frontend.FrontendBridge;
import com.llmbridge.frontend.OpenAiFrontend;
import com.llmbridge.providers.ListModelsOptions;
import com.llmbridge.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class LlmBridgeApp {

    private static final Logger log = LoggerFactory.getLogger(LlmBridgeApp.class);

    private final Bridge bridge;
    private final ObjectMapper mapper = new ObjectMapper();

    public LlmBridgeApp(Bridge bridge) {
        this.bridge = bridge;
    }

    public static void main(String[] args) {
        var assembler = new BridgeAssembler(ConfigLoader.load());
        int code;
        try (var bridge = assembler.assemble()) {
            var stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            code = new LlmBridgeApp(bridge).run(args, stdin, System.out, System.err);
            var costs = assembler.costTracker().summary();
            if (costs.requests() > 0) {
                log.info("Session cost: {} requests, ${}", costs.requests(), String.format("%.6f", costs.totalCost()));
            }
        }
        System.exit(code);
    }

    public int run(String[] args, Reader in, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            usage(err);
            return 2;
        }
        var rest = List.of(args).subList(1, args.length);
        try {
            return switch (args[0]) {
                case "chat" -> chat(rest, in, out, err);
                case "models" -> models(rest, out, err);
                case "backends" -> {
                    bridge.registry().names().forEach(out::println);
                    yield 0;
                }
                default -> {
                    err.println("Unknown command: " + args[0]);
                    usage(err);
                    yield 2;
                }
            };
        } catch (BridgeException e) {
            log.debug("Command {} failed", args[0], e);
            err.println(e.kind().name().toLowerCase() + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    private int chat(List<String> args, Reader in, PrintStream out, PrintStream err) throws IOException {
        FrontendAdapter frontend = new OpenAiFrontend();
        var options = DispatchOptions.defaults();
        boolean stream = false;
        String file = null;
        for (int i = 0; i < args.size(); i++) {
            var arg = args.get(i);
            switch (arg) {
                case "--frontend" -> {
                    var name = value(args, ++i);
                    if (name == null) return missing(arg, err);
                    frontend = switch (name) {
                        case "openai" -> new OpenAiFrontend();
                        case "anthropic" -> new AnthropicFrontend();
                        default -> null;
                    };
                    if (frontend == null) {
                        err.println("Unknown frontend: " + name);
                        return 2;
                    }
                }
                case "--backend" -> {
                    var name = value(args, ++i);
                    if (name == null) return missing(arg, err);
                    options = options.withBackend(name);
                }
                case "--stream" -> stream = true;
                default -> file = arg;
            }
        }

        var raw = file == null || "-".equals(file) ? readAll(in) : Files.readString(Path.of(file));
        JsonNode body;
        try {
            body = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ValidationException(null, "request body is not valid JSON");
        }
        var frontendBridge = new FrontendBridge(bridge, frontend, mapper);
        try {
            if (stream) {
                var writer = new PrintWriter(out, true, StandardCharsets.UTF_8);
                frontendBridge.streamSse(body, options, writer);
                writer.flush();
            } else {
                out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(frontendBridge.chat(body, options)));
            }
            return 0;
        } catch (BridgeException e) {
            out.println(mapper.writeValueAsString(frontendBridge.error(e)));
            return 1;
        }
    }

    private int models(List<String> args, PrintStream out, PrintStream err) {
        String backend = null;
        boolean refresh = false;
        for (var arg : args) {
            if ("--refresh".equals(arg)) refresh = true;
            else backend = arg;
        }
        if (backend == null) return missing("BACKEND", err);
        var result = bridge.listModels(backend, refresh ? ListModelsOptions.refresh() : ListModelsOptions.defaults());
        out.println("# source=" + result.source().name().toLowerCase() + " complete=" + result.complete());
        result.models().forEach(m -> out.println(m.id()));
        return 0;
    }

    private static String value(List<String> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    private static int missing(String what, PrintStream err) {
        err.println("Missing value for " + what);
        return 2;
    }

    private static String readAll(Reader in) {
        var lines = new ArrayList<String>();
        try {
            var buffered = in instanceof BufferedReader br ? br : new BufferedReader(in);
            String line;
            while ((line = buffered.readLine()) != null) lines.add(line);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read request body", e);
        }
        return lines.stream().collect(Collectors.joining("\n"));
    }

    private static void usage(PrintStream err) {
        err.println("Usage: llm-bridge chat [--frontend openai|anthropic] [--backend NAME] [--stream] [FILE]");
        err.println("       llm-bridge models BACKEND [--refresh]");
        err.println("       llm-bridge backends");
    }
}
