package com.acled.client.core.exception;

/**
 * Base type for the recoverable failures of a fetch: transport, API-reported and field-parse errors.
 * A fetch that throws one of these has returned no records at all.
 */
public abstract class AcledException extends Exception {

    protected AcledException(String message) {
        super(message);
    }

    protected AcledException(String message, Throwable cause) {
        super(message, cause);
    }
}
