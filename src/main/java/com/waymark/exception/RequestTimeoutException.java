package com.waymark.exception;

import java.time.Duration;

/**
 * No complete response arrived within the configured per-request timeout.
 */
public class RequestTimeoutException extends ApiException {

    public RequestTimeoutException(Duration timeout, int attempts, Duration elapsed, Throwable cause) {
        super("Request timeout after " + timeout.toMillis() + " ms",
                "timeout", null, attempts, elapsed, true, cause);
    }
}
