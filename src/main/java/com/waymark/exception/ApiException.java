package com.waymark.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Base failure of a call made through a {@code ResilientClient}.
 *
 * <p>Carries what a caller needs to decide between surfacing the failure and retrying at
 * a higher level: the HTTP status (when there was a response), how many attempts were
 * made and how long the request took overall.
 */
@Getter
public class ApiException extends RuntimeException {

    private final String errorCode;
    private final Integer statusCode;
    private final int attempts;
    private final Duration elapsed;
    private final boolean retryable;

    public ApiException(String message, String errorCode, Integer statusCode,
                        int attempts, Duration elapsed, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
        this.attempts = attempts;
        this.elapsed = elapsed;
        this.retryable = retryable;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode
                + (statusCode != null ? ", status=" + statusCode : "")
                + ", attempts=" + attempts
                + ", elapsed=" + (elapsed != null ? elapsed.toMillis() + "ms" : "n/a")
                + "]: " + getMessage();
    }
}
