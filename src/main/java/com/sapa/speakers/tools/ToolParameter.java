package com.sapa.speakers.tools;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One declared argument of a tool. {@code type} uses JSON schema names: string, integer, array.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ToolParameter(String name, String type, boolean required, String description, List<String> allowedValues) {

    public ToolParameter {
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public static ToolParameter required(String name, String type, String description) {
        return new ToolParameter(name, type, true, description, List.of());
    }

    public static ToolParameter optional(String name, String type, String description) {
        return new ToolParameter(name, type, false, description, List.of());
    }

    public static ToolParameter choice(String name, boolean required, String description, List<String> allowedValues) {
        return new ToolParameter(name, "string", required, description, allowedValues);
    }
}
