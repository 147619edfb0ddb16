package com.waymark.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time response cache statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private long hits;

    private long misses;

    /**
     * Entries currently held, expired-but-unswept ones included.
     */
    private int size;

    private int maxSize;

    /**
     * Hits over total lookups (0.0-1.0); 0 before the first lookup.
     */
    private double hitRate;

    private long totalRequests;
}
