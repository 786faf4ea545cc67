package com.openforge.netagent.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * One step of a query's execution trace, returned with the outcome and
 * written to the log.
 *
 *   conversationId : conversation the query belongs to
 *   type           : what happened
 *   content        : free text (answer for FINAL_ANSWER, message for ERROR)
 *   payload        : structured detail for PLAN_READY / TOOL_CALL / TOOL_RESULT
 *   iteration      : reasoning round; 0 for plan-driven steps before the first round
 *   timestamp      : epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        String    conversationId,
        EventType type,
        String    content,
        Object    payload,
        int       iteration,
        long      timestamp
) {

    public static AgentEvent planReady(String conversationId, List<String> steps) {
        return new AgentEvent(conversationId, EventType.PLAN_READY, null, steps, 0, now());
    }

    public static AgentEvent iterationStart(String conversationId, int iteration) {
        return new AgentEvent(conversationId, EventType.ITERATION_START, null, null, iteration, now());
    }

    public static AgentEvent toolCall(String conversationId, String tool, String operation,
                                      Map<String, Object> filters, int iteration) {
        return new AgentEvent(conversationId, EventType.TOOL_CALL, null,
                new ToolCallPayload(tool, operation, filters), iteration, now());
    }

    public static AgentEvent toolResult(String conversationId, ToolResultPayload result, int iteration) {
        return new AgentEvent(conversationId, EventType.TOOL_RESULT, null, result, iteration, now());
    }

    public static AgentEvent finalAnswer(String conversationId, String answer, int iteration) {
        return new AgentEvent(conversationId, EventType.FINAL_ANSWER, answer, null, iteration, now());
    }

    public static AgentEvent error(String conversationId, String message, int iteration) {
        return new AgentEvent(conversationId, EventType.ERROR, message, null, iteration, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    // ── Payload types ────────────────────────────────────────────────────────

    public record ToolCallPayload(String tool, String operation, Map<String, Object> filters) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolResultPayload(String tool, String operation, boolean success,
                                    int recordCount, String error, long durationMillis, boolean cached) {}
}
