package com.openforge.netagent.agent;

import com.openforge.netagent.context.ContextManager;

/**
 * One conversation: a context of recent queries plus the loop that answers them.
 *
 * Queries on the same conversation are processed one at a time; separate
 * conversations share nothing but the registry and may run in parallel.
 */
public class Conversation {

    private final String         id;
    private final ContextManager context;
    private final ReActLoop      loop;

    public Conversation(String id, ContextManager context, ReActLoop loop) {
        this.id      = id;
        this.context = context;
        this.loop    = loop;
    }

    public String id() {
        return id;
    }

    public synchronized QueryOutcome run(String query) {
        return loop.run(id, query, context);
    }

    /**
     * @throws QueryFailedException when the query ends in a failed state
     */
    public String ask(String query) {
        return run(query).answerOrThrow();
    }

    public synchronized void clearContext() {
        context.clear();
    }

    ContextManager context() {
        return context;
    }
}
