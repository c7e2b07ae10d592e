package com.sapa.speakers.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit action-name to tool mapping, filled once at startup.
 * Invocation checks arguments against the declared parameters before calling the handler,
 * and always completes with text: failures become an "Error ..." line instead of an error signal.
 */
public class ToolRegistry {
    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();

    public void register(ToolDefinition tool) {
        if (tools.putIfAbsent(tool.name(), tool) != null) {
            throw new IllegalStateException("Tool already registered: " + tool.name());
        }
    }

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<ToolDefinition> definitions() {
        return tools.values();
    }

    public Set<String> names() {
        return tools.keySet();
    }

    public int size() {
        return tools.size();
    }

    public Mono<String> invoke(String name, Map<String, Object> rawArguments) {
        ToolDefinition tool = tools.get(name);
        if (tool == null) {
            return Mono.just("Error: unknown tool '" + name + "'. Available tools: " + names());
        }
        ToolArguments args = new ToolArguments(rawArguments);
        String problem = checkArguments(tool, args);
        if (problem != null) {
            log.warn("Rejected {} call: {}", name, problem);
            return Mono.just("Error: " + problem);
        }
        log.debug("Invoking tool {} with arguments {}", name, args.names());
        return Mono.defer(() -> tool.handler().apply(args))
                .onErrorResume(e -> {
                    log.warn("Tool {} failed: {}", name, e.toString());
                    return Mono.just("Error running " + name + ": " + e.getMessage());
                });
    }

    private static String checkArguments(ToolDefinition tool, ToolArguments args) {
        List<String> unknown = new ArrayList<>();
        for (String given : args.names()) {
            boolean declared = tool.parameters().stream().anyMatch(p -> p.name().equals(given));
            if (!declared) unknown.add(given);
        }
        if (!unknown.isEmpty()) {
            return "unknown argument(s) " + unknown + " for " + tool.name();
        }
        for (ToolParameter p : tool.parameters()) {
            if (p.required() && !args.has(p.name())) {
                return "missing required argument '" + p.name() + "' for " + tool.name();
            }
        }
        return null;
    }
}
