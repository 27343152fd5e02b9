package com.acled.client.core.exception;

/** The API answered with its structured error envelope ({@code success: false}). */
public class ApiErrorException extends AcledException {
    private final String apiMessage;

    public ApiErrorException(String apiMessage) {
        super("API returned an error: " + apiMessage);
        this.apiMessage = apiMessage;
    }

    /** Message text exactly as sent by the API. */
    public String apiMessage() {
        return apiMessage;
    }
}
