package com.openforge.netagent.adapter;

/**
 * Raised by adapters for a single failed backend call.
 * The registry turns it into a failed {@code ToolInvocationResult}; it never escapes a dispatch.
 */
public class AdapterException extends RuntimeException {

    private final AdapterErrorKind kind;
    private final boolean          retryable;

    public AdapterException(AdapterErrorKind kind, String message) {
        this(kind, message, null, true);
    }

    public AdapterException(AdapterErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, true);
    }

    private AdapterException(AdapterErrorKind kind, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.kind      = kind;
        this.retryable = retryable;
    }

    public AdapterErrorKind kind() {
        return kind;
    }

    /** False when repeating the same call cannot succeed. */
    public boolean retryable() {
        return retryable;
    }

    public static AdapterException unsupported(String toolName, Operation operation) {
        return new AdapterException(AdapterErrorKind.BACKEND_ERROR,
                "Operation '%s' is not supported by %s".formatted(operation.wireName(), toolName), null, false);
    }
}
