package com.waymark.exception;

import java.time.Duration;

/**
 * The remote API failed with a 5xx status.
 */
public class ServerErrorException extends ApiException {

    public ServerErrorException(int statusCode, String bodyExcerpt, int attempts, Duration elapsed) {
        super("API request failed with status " + statusCode + ": " + bodyExcerpt,
                "server_error", statusCode, attempts, elapsed, true, null);
    }
}
