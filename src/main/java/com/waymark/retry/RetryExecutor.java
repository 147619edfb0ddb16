package com.waymark.retry;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Runs an asynchronous operation up to {@code maxAttempts} times, sleeping between
 * attempts according to a {@link BackoffPolicy}.
 *
 * <p>Only failures accepted by the retry predicate are retried. Anything else, and the
 * failure of the last attempt, is propagated unchanged.
 */
@Slf4j
public class RetryExecutor {

    private final int maxAttempts;
    private final BackoffPolicy backoff;

    public RetryExecutor(int maxAttempts, BackoffPolicy backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        backoff.validate();
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    /**
     * @param operation name used in log messages
     * @param attempt   produces the {@code Mono} for a given 0-indexed attempt
     * @param retryable decides whether a failure is worth another attempt
     */
    public <T> Mono<T> execute(String operation, IntFunction<Mono<T>> attempt, Predicate<Throwable> retryable) {
        return run(operation, 0, attempt, retryable);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public BackoffPolicy getBackoff() {
        return backoff;
    }

    private <T> Mono<T> run(String operation, int attemptIndex, IntFunction<Mono<T>> attempt,
                            Predicate<Throwable> retryable) {
        return Mono.defer(() -> attempt.apply(attemptIndex))
                .doOnSuccess(result -> {
                    if (attemptIndex > 0) {
                        log.info("Retry successful: operation={} attempt={} maxAttempts={}",
                                operation, attemptIndex + 1, maxAttempts);
                    }
                })
                .onErrorResume(error -> {
                    if (!retryable.test(error)) {
                        log.error("Non-retryable failure: operation={} attempt={} error={}",
                                operation, attemptIndex + 1, error.getMessage());
                        return Mono.error(error);
                    }
                    if (attemptIndex >= maxAttempts - 1) {
                        log.error("Max retries exceeded: operation={} attempts={} error={}",
                                operation, maxAttempts, error.getMessage());
                        return Mono.error(error);
                    }

                    Duration delay = backoff.delayFor(attemptIndex);
                    log.warn("Request failed (will retry): operation={} attempt={} nextDelayMs={} error={}",
                            operation, attemptIndex + 1, delay.toMillis(), error.getMessage());
                    return Mono.delay(delay).then(run(operation, attemptIndex + 1, attempt, retryable));
                });
    }
}
