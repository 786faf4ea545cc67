package com.openforge.netagent.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * One entry of the chat transcript. Roles: system, user, assistant, tool.
 * An assistant message carries either content or tool calls; a tool message
 * answers the call named by {@code toolCallId}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) {

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role("assistant").content(content).build();
    }

    public static Message assistantToolCalls(List<ToolCall> toolCalls) {
        return Message.builder().role("assistant").toolCalls(List.copyOf(toolCalls)).build();
    }

    public static Message toolResult(String toolCallId, String observation) {
        return Message.builder().role("tool").toolCallId(toolCallId).content(observation).build();
    }
}
