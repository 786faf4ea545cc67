package com.openforge.netagent.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Body of a POST to {@code /chat/completions}. Null fields are left out of the JSON.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens
) {

    /** Reasoning request: the model may either call a tool or answer. */
    public static ChatRequest reasoning(List<Message> messages, List<Tool> tools,
                                        double temperature, int maxTokens) {
        return ChatRequest.builder()
                .messages(List.copyOf(messages))
                .tools(tools == null || tools.isEmpty() ? null : tools)
                .toolChoice(tools == null || tools.isEmpty() ? null : "auto")
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }
}
