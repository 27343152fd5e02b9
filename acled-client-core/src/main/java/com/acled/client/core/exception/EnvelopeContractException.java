package com.acled.client.core.exception;

/**
 * The response body matched neither the data envelope nor the error envelope, or its {@code success}/{@code count}
 * fields contradict its payload. This is a breach of the API contract, not a condition callers are expected to
 * handle.
 */
public class EnvelopeContractException extends IllegalStateException {

    public EnvelopeContractException(String message) {
        super(message);
    }
}
