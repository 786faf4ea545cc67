package com.openforge.netagent.agent;

import com.openforge.netagent.agent.event.AgentEvent;

import java.util.List;
import java.util.Map;

/**
 * Terminal result of one query.
 *
 * @param state           DONE or FAILED
 * @param answer          final answer including any caveat note; null when failed
 * @param failureKind     set when failed
 * @param message         failure message; null when done
 * @param caveats         data sources that failed during the run, e.g. "librenms: TIMEOUT (...)"
 * @param iterations      reasoning rounds used
 * @param implicitFilters filters inherited from conversation context
 * @param events          execution trace
 */
public record QueryOutcome(
        LoopState state,
        String answer,
        FailureKind failureKind,
        String message,
        List<String> caveats,
        int iterations,
        Map<String, Object> implicitFilters,
        List<AgentEvent> events
) {

    public QueryOutcome {
        caveats         = List.copyOf(caveats);
        implicitFilters = implicitFilters == null ? Map.of() : Map.copyOf(implicitFilters);
        events          = List.copyOf(events);
    }

    public boolean succeeded() {
        return state == LoopState.DONE;
    }

    /** The answer, or {@link QueryFailedException} for a failed outcome. */
    public String answerOrThrow() {
        if (!succeeded()) {
            throw new QueryFailedException(failureKind, message);
        }
        return answer;
    }
}
