package com.waymark.exception;

import java.time.Duration;

/**
 * The requested resource does not exist (HTTP 404).
 */
public class NotFoundException extends ClientErrorException {

    public NotFoundException(String bodyExcerpt, int attempts, Duration elapsed) {
        super("resource_not_found", 404, bodyExcerpt, attempts, elapsed);
    }
}
