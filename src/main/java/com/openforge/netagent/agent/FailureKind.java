package com.openforge.netagent.agent;

/**
 * Why a query ended in {@link LoopState#FAILED}.
 */
public enum FailureKind {

    /** The iteration cap was reached without a final answer. */
    REASONING_EXHAUSTED,

    /** Every tool failed in two consecutive action rounds. */
    ADAPTER_FAILURE,

    /** No pattern matched and falling back to every tool is disabled. */
    PLANNING_AMBIGUOUS,

    /** No LLM provider could be reached. */
    LLM_UNAVAILABLE
}
