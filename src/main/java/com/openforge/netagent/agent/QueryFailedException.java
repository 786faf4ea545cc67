package com.openforge.netagent.agent;

/**
 * Thrown by {@code processQuery} when a query ends in a failed state.
 */
public class QueryFailedException extends RuntimeException {

    private final FailureKind kind;

    public QueryFailedException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
