package com.waymark.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <p>The delay for attempt {@code n} (0-indexed) is {@code min(maxDelay, baseDelay * exponentialBase^n)},
 * moved by a uniformly random amount of up to {@code jitterFactor} times itself in either
 * direction, then clamped back into {@code [0, maxDelay]}.
 */
@Value
@Builder(toBuilder = true)
public class BackoffPolicy {

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    double exponentialBase = 2.0;

    /**
     * Fraction of the delay used as the jitter band (0-1).
     */
    @Builder.Default
    double jitterFactor = 0.5;

    public static BackoffPolicy defaults() {
        return BackoffPolicy.builder().build();
    }

    /**
     * Delay to wait after the given failed attempt.
     */
    public Duration delayFor(int attempt) {
        double maxMillis = maxDelay.toMillis();
        double delay = Math.min(maxMillis, baseDelay.toMillis() * Math.pow(exponentialBase, attempt));

        double jitterRange = delay * jitterFactor;
        if (jitterRange > 0) {
            delay = delay - jitterRange + ThreadLocalRandom.current().nextDouble() * jitterRange * 2;
        }

        delay = Math.max(0, Math.min(delay, maxMillis));
        return Duration.ofMillis(Math.round(delay));
    }

    public void validate() {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative: " + baseDelay);
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative: " + maxDelay);
        }
        if (exponentialBase < 1.0) {
            throw new IllegalArgumentException("exponentialBase must be >= 1.0: " + exponentialBase);
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]: " + jitterFactor);
        }
    }
}
