package com.waymark.client;

import com.waymark.exception.ClientValidationException;
import com.waymark.retry.BackoffPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Construction-time configuration of a {@link ResilientClient}.
 */
@Value
@Builder(toBuilder = true)
public class ClientSettings {

    String baseUrl;

    /**
     * Sent as a bearer token when present.
     */
    String apiKey;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    /**
     * Total attempts per request, the first one included.
     */
    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    int rateLimitCallsPerPeriod = 100;

    @Builder.Default
    Duration rateLimitPeriod = Duration.ofSeconds(60);

    @Builder.Default
    double burstMultiplier = 1.0;

    @Builder.Default
    boolean cacheEnabled = true;

    @Builder.Default
    Duration cacheTtl = Duration.ofHours(1);

    @Builder.Default
    int cacheMaxSize = 1000;

    /**
     * Interval of the background expiry sweep; zero disables it.
     */
    @Builder.Default
    Duration cleanupInterval = Duration.ofMinutes(5);

    @Builder.Default
    BackoffPolicy backoff = BackoffPolicy.defaults();

    @Builder.Default
    String userAgent = "Waymark/1.0";

    void validate() {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ClientValidationException("timeout must be positive: " + timeout);
        }
        if (maxRetries < 1) {
            throw new ClientValidationException("maxRetries must be at least 1: " + maxRetries);
        }
        if (rateLimitCallsPerPeriod <= 0) {
            throw new ClientValidationException("rateLimitCallsPerPeriod must be positive: " + rateLimitCallsPerPeriod);
        }
        if (rateLimitPeriod == null || rateLimitPeriod.isZero() || rateLimitPeriod.isNegative()) {
            throw new ClientValidationException("rateLimitPeriod must be positive: " + rateLimitPeriod);
        }
        if (burstMultiplier < 1.0) {
            throw new ClientValidationException("burstMultiplier must be >= 1.0: " + burstMultiplier);
        }
        if (cacheEnabled && cacheMaxSize <= 0) {
            throw new ClientValidationException("cacheMaxSize must be positive: " + cacheMaxSize);
        }
        if (backoff == null) {
            throw new ClientValidationException("backoff must be set");
        }
    }
}
