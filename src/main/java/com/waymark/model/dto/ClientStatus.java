package com.waymark.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Observability snapshot of one configured client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientStatus {

    private String name;

    private String baseUrl;

    /**
     * UNSET, INITIALIZING, READY or CLOSED.
     */
    private String connectionState;

    /**
     * Seconds until the rate limiter admits the next call; 0 when a token is available.
     */
    private double rateLimitWaitSeconds;

    private double availableTokens;

    private boolean cacheEnabled;

    /**
     * Absent when caching is disabled for this client.
     */
    private CacheStatistics cache;
}
