package com.waymark.exception;

/**
 * Invalid client configuration, raised while constructing a client.
 */
public class ClientValidationException extends ApiException {

    public ClientValidationException(String message) {
        super(message, "validation_error", null, 0, null, false, null);
    }
}
