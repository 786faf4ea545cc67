package com.openforge.netagent.agent.event;

/**
 * Classifies the trace events recorded while a query runs.
 *
 * Flow: PLAN_READY → (TOOL_CALL → TOOL_RESULT)* → ITERATION_START → … → FINAL_ANSWER | ERROR
 */
public enum EventType {

    /** The planner's decision. payload = list of planned steps. */
    PLAN_READY,

    /** A reasoning round begins. */
    ITERATION_START,

    /** A tool is about to be queried. payload = ToolCallPayload. */
    TOOL_CALL,

    /** A tool answered or failed. payload = ToolResultPayload. */
    TOOL_RESULT,

    /** Terminal: answer produced. content = answer. */
    FINAL_ANSWER,

    /** Terminal: the query failed. content = message. */
    ERROR
}
