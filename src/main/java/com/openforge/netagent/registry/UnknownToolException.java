package com.openforge.netagent.registry;

public class UnknownToolException extends RuntimeException {

    private final String identifier;

    public UnknownToolException(String identifier) {
        super("No tool registered under name or alias '%s'".formatted(identifier));
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
