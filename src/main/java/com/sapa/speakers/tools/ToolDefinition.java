package com.sapa.speakers.tools;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * A named action: its parameter schema and the handler that renders a plain-text result.
 */
public record ToolDefinition(String name, String description, List<ToolParameter> parameters,
                             Function<ToolArguments, Mono<String>> handler) {

    public ToolDefinition {
        parameters = List.copyOf(parameters);
    }
}
