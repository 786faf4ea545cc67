package com.openforge.netagent.llm.model;

/**
 * A tool invocation requested by the model. {@code function.arguments} is a
 * raw JSON string that the caller parses.
 */
public record ToolCall(String id, String type, FunctionCall function) {

    public static ToolCall of(String id, String name, String argumentsJson) {
        return new ToolCall(id, "function", new FunctionCall(name, argumentsJson));
    }

    public record FunctionCall(String name, String arguments) {}
}
