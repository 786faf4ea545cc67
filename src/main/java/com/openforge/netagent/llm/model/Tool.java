package com.openforge.netagent.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Function tool offered to the model: {"type": "function", "function": {...}}.
 */
public record Tool(String type, Function function) {

    public static Tool function(String name, String description, JsonNode parametersSchema) {
        return new Tool("function", new Function(name, description, parametersSchema));
    }

    /** {@code parameters} is a JSON Schema object, passed through verbatim. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Function(String name, String description, JsonNode parameters) {}
}
