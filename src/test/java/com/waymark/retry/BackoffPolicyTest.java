package com.waymark.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackoffPolicy.
 */
class BackoffPolicyTest {

    @Test
    void testExponentialGrowthWithoutJitter() {
        BackoffPolicy policy = BackoffPolicy.builder()
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(10))
                .jitterFactor(0)
                .build();

        assertEquals(Duration.ofMillis(100), policy.delayFor(0));
        assertEquals(Duration.ofMillis(200), policy.delayFor(1));
        assertEquals(Duration.ofMillis(400), policy.delayFor(2));
        assertEquals(Duration.ofMillis(800), policy.delayFor(3));
    }

    @Test
    void testDelayIsCappedAtMaxDelay() {
        BackoffPolicy policy = BackoffPolicy.builder()
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(5))
                .jitterFactor(0)
                .build();

        assertEquals(Duration.ofSeconds(5), policy.delayFor(10));
    }

    @Test
    void testJitterStaysWithinBandAndNeverExceedsCap() {
        BackoffPolicy policy = BackoffPolicy.builder()
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(30))
                .jitterFactor(0.5)
                .build();

        for (int i = 0; i < 1000; i++) {
            long attempt0 = policy.delayFor(0).toMillis();
            assertTrue(attempt0 >= 500 && attempt0 <= 1500, "delay out of band: " + attempt0);

            long capped = policy.delayFor(20).toMillis();
            assertTrue(capped >= 0 && capped <= 30_000, "delay above cap: " + capped);
        }
    }

    @Test
    void testFullJitterNeverGoesNegative() {
        BackoffPolicy policy = BackoffPolicy.builder()
                .baseDelay(Duration.ofMillis(10))
                .jitterFactor(1.0)
                .build();

        for (int i = 0; i < 1000; i++) {
            assertFalse(policy.delayFor(0).isNegative());
        }
    }

    @Test
    void testDefaults() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertEquals(Duration.ofSeconds(1), policy.getBaseDelay());
        assertEquals(Duration.ofSeconds(30), policy.getMaxDelay());
        assertEquals(2.0, policy.getExponentialBase());
        assertEquals(0.5, policy.getJitterFactor());
    }

    @Test
    void testInvalidJitterIsRejected() {
        BackoffPolicy policy = BackoffPolicy.builder().jitterFactor(1.5).build();

        assertThrows(IllegalArgumentException.class, policy::validate);
    }
}
