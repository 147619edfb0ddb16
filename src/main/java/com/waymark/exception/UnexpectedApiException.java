package com.waymark.exception;

import java.time.Duration;

/**
 * A failure that matches no known category, typically a bug in request or response handling.
 * Never retried.
 */
public class UnexpectedApiException extends ApiException {

    public UnexpectedApiException(int attempts, Duration elapsed, Throwable cause) {
        super("Unexpected error: " + cause, "unexpected_error", null, attempts, elapsed, false, cause);
    }
}
