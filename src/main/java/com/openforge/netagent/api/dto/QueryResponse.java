package com.openforge.netagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.netagent.agent.QueryOutcome;
import com.openforge.netagent.agent.event.AgentEvent;

import java.util.List;

/**
 * Response body for POST /api/network/query. camelCase on the wire, like the
 * request, regardless of the global snake_case strategy.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record QueryResponse(
        String           conversationId,
        String           status,
        String           answer,
        List<String>     caveats,
        int              iterations,
        String           failureKind,
        String           message,
        List<AgentEvent> events
) {

    public static QueryResponse from(String conversationId, QueryOutcome outcome) {
        return new QueryResponse(
                conversationId,
                outcome.state().name(),
                outcome.answer(),
                outcome.caveats(),
                outcome.iterations(),
                outcome.failureKind() == null ? null : outcome.failureKind().name(),
                outcome.message(),
                outcome.events()
        );
    }
}
