package com.openforge.netagent.agent;

/**
 * States of the reasoning loop. DONE and FAILED are terminal.
 */
public enum LoopState {
    REASONING,
    ACTING,
    OBSERVING,
    DONE,
    FAILED
}
