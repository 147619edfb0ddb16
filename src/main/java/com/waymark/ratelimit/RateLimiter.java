package com.waymark.ratelimit;

import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket rate limiter for outbound API calls.
 *
 * <p>Capacity refills continuously at {@code callsPerPeriod / period} tokens per second,
 * capped at {@code callsPerPeriod * burstMultiplier}. Refill and deduction happen under a
 * single lock, so concurrent acquirers never spend the same token twice. Waiting is done
 * with {@link Mono#delay(Duration)} outside the lock; cancelling a pending acquire leaves
 * the bucket untouched.
 *
 * <p>Waiting is unbounded: an acquire keeps re-checking the bucket until it is admitted.
 * Callers that need an upper bound apply {@code timeout(...)} to the returned {@code Mono}.
 */
@Slf4j
public class RateLimiter {

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final int callsPerPeriod;
    private final Duration period;
    private final double maxTokens;
    private final double refillRatePerSecond;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillNanos;

    public RateLimiter(int callsPerPeriod, Duration period) {
        this(callsPerPeriod, period, 1.0);
    }

    public RateLimiter(int callsPerPeriod, Duration period, double burstMultiplier) {
        this(callsPerPeriod, period, burstMultiplier, Ticker.systemTicker());
    }

    public RateLimiter(int callsPerPeriod, Duration period, double burstMultiplier, Ticker ticker) {
        if (callsPerPeriod <= 0) {
            throw new IllegalArgumentException("callsPerPeriod must be positive: " + callsPerPeriod);
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        if (burstMultiplier < 1.0) {
            throw new IllegalArgumentException("burstMultiplier must be >= 1.0: " + burstMultiplier);
        }
        this.callsPerPeriod = callsPerPeriod;
        this.period = period;
        this.maxTokens = callsPerPeriod * burstMultiplier;
        this.refillRatePerSecond = callsPerPeriod / (period.toNanos() / NANOS_PER_SECOND);
        this.ticker = ticker;
        this.tokens = maxTokens;
        this.lastRefillNanos = ticker.read();
    }

    /**
     * Acquire a single token.
     */
    public Mono<Void> acquire() {
        return acquire(1);
    }

    /**
     * Acquire {@code requested} tokens, waiting for refill as long as necessary.
     *
     * @param requested number of tokens, between 1 and the bucket capacity
     * @return a {@code Mono} completing once the tokens have been deducted
     */
    public Mono<Void> acquire(int requested) {
        if (requested < 1 || requested > maxTokens) {
            return Mono.error(new IllegalArgumentException(
                    "requested tokens must be between 1 and " + maxTokens + ": " + requested));
        }
        return Mono.defer(() -> {
            double waitSeconds = tryConsume(requested);
            if (waitSeconds <= 0) {
                return Mono.empty();
            }
            log.debug("Rate limit waiting for tokens: waitSeconds={} requested={}",
                    String.format("%.3f", waitSeconds), requested);
            // Re-check after the delay; other acquirers may have drained the refill meanwhile.
            return Mono.delay(toDuration(waitSeconds)).then(acquire(requested));
        });
    }

    /**
     * Time until a single token is available, without consuming anything.
     */
    public Duration getWaitTime() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1) {
                return Duration.ZERO;
            }
            return toDuration((1 - tokens) / refillRatePerSecond);
        } finally {
            lock.unlock();
        }
    }

    public double getAvailableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refill the bucket to capacity.
     */
    public void reset() {
        lock.lock();
        try {
            tokens = maxTokens;
            lastRefillNanos = ticker.read();
            log.debug("Rate limiter reset: tokens={}", tokens);
        } finally {
            lock.unlock();
        }
    }

    public int getCallsPerPeriod() {
        return callsPerPeriod;
    }

    public Duration getPeriod() {
        return period;
    }

    public double getMaxTokens() {
        return maxTokens;
    }

    /**
     * Deduct tokens if available.
     *
     * @return 0 when the tokens were deducted, otherwise the seconds until the deficit refills
     */
    private double tryConsume(int requested) {
        lock.lock();
        try {
            refill();
            if (tokens >= requested) {
                tokens -= requested;
                log.debug("Rate limit tokens acquired: acquired={} remaining={} max={}",
                        requested, tokens, maxTokens);
                return 0;
            }
            return (requested - tokens) / refillRatePerSecond;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = ticker.read();
        long elapsedNanos = now - lastRefillNanos;
        if (elapsedNanos > 0) {
            tokens = Math.min(maxTokens, tokens + (elapsedNanos / NANOS_PER_SECOND) * refillRatePerSecond);
            lastRefillNanos = now;
        }
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos((long) Math.ceil(seconds * NANOS_PER_SECOND));
    }
}
