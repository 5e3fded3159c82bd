package com.neoforge.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A tool invocation requested by the model.
 * Wire shape: {@code {id, type: "function", function: {name, arguments}}}, where
 * arguments is a JSON document encoded as a string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCall(String id, String type, Function function) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Function(String name, String arguments) {}

    public static ToolCall of(String id, String name, String argumentsJson) {
        return new ToolCall(id, "function", new Function(name, argumentsJson));
    }

    public String functionName() {
        return function == null ? null : function.name();
    }

    public String argumentsJson() {
        return function == null ? null : function.arguments();
    }
}
