package com.openforge.netagent.adapter;

/**
 * Classifies a failed backend call.
 */
public enum AdapterErrorKind {

    /** The requested entity or endpoint does not exist. */
    NOT_FOUND,

    /** Credentials rejected (HTTP 401/403). */
    UNAUTHORIZED,

    /** The call did not complete within its deadline. */
    TIMEOUT,

    /** Anything else: 5xx, malformed payload, connection refused, unsupported operation. */
    BACKEND_ERROR
}
