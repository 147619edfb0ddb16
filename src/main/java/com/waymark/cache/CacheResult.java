package com.waymark.cache;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a cache lookup.
 *
 * <p>A hit may carry a {@code null} value; only {@link #miss()} means "not present".
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CacheResult {

    private static final CacheResult MISS = new CacheResult(false, null);

    private final boolean hit;
    private final Object value;

    public static CacheResult hit(Object value) {
        return new CacheResult(true, value);
    }

    public static CacheResult miss() {
        return MISS;
    }

    public boolean isMiss() {
        return !hit;
    }

    @SuppressWarnings("unchecked")
    public <T> T valueAs() {
        return (T) value;
    }
}
