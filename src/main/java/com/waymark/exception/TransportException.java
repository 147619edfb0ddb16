package com.waymark.exception;

import java.time.Duration;

/**
 * Connection-level failure: DNS resolution, refused or reset connections.
 */
public class TransportException extends ApiException {

    public TransportException(String detail, int attempts, Duration elapsed, Throwable cause) {
        super("Request failed: " + detail, "transport_error", null, attempts, elapsed, true, cause);
    }
}
