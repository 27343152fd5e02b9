package com.acled.client.core.exception;

/** The HTTP exchange for a page could not be completed, or its body could not be read as JSON. */
public class TransportException extends AcledException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
