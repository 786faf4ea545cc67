package com.openforge.netagent.registry;

/**
 * A tool name or alias collides with one already registered.
 * Names and aliases share one namespace.
 */
public class DuplicateToolException extends RuntimeException {

    public DuplicateToolException(String message) {
        super(message);
    }
}
