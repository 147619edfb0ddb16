package com.waymark.cache;

import lombok.Value;

/**
 * A cached value with the ticker reading it was stored at and how long it is served.
 * Ticker readings are only compared by difference, so wrap-around is harmless.
 */
@Value
public class CacheEntry {

    Object value;
    long storedAtNanos;
    long ttlNanos;

    public boolean isExpired(long nowNanos) {
        return nowNanos - storedAtNanos >= ttlNanos;
    }
}
