package com.waymark.exception;

import java.time.Duration;

/**
 * The remote API rejected the request with a 4xx status.
 *
 * <p>Only 408 (request timeout) and 429 (too many requests) are worth retrying; every
 * other 4xx fails on the first attempt.
 */
public class ClientErrorException extends ApiException {

    public ClientErrorException(int statusCode, String bodyExcerpt, int attempts, Duration elapsed) {
        this("client_error", statusCode, bodyExcerpt, attempts, elapsed);
    }

    protected ClientErrorException(String errorCode, int statusCode, String bodyExcerpt,
                                   int attempts, Duration elapsed) {
        super("API request failed with status " + statusCode + ": " + bodyExcerpt,
                errorCode, statusCode, attempts, elapsed, isRetryableStatus(statusCode), null);
    }

    static boolean isRetryableStatus(int statusCode) {
        return statusCode == 408 || statusCode == 429;
    }
}
