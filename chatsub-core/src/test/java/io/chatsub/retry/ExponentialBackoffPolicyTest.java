package io.chatsub.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExponentialBackoffPolicyTest {

    @Test
    void defaultDoublesFromOneSecond() {
        assertEquals(Duration.ofSeconds(1), ExponentialBackoffPolicy.DEFAULT.delayFor(0));
        assertEquals(Duration.ofSeconds(2), ExponentialBackoffPolicy.DEFAULT.delayFor(1));
        assertEquals(Duration.ofSeconds(4), ExponentialBackoffPolicy.DEFAULT.delayFor(2));
        assertEquals(Duration.ofSeconds(32), ExponentialBackoffPolicy.DEFAULT.delayFor(5));
    }

    @Test
    void defaultIsCappedAtSixtySeconds() {
        assertEquals(Duration.ofSeconds(60), ExponentialBackoffPolicy.DEFAULT.delayFor(6));
        assertEquals(Duration.ofSeconds(60), ExponentialBackoffPolicy.DEFAULT.delayFor(20));
    }

    @Test
    void handlesAttemptCountAtOverflowBoundary() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(30), policy.delayFor(61));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(62));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(Integer.MAX_VALUE));
    }

    @Test
    void zeroBaseDelayReturnsZero() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ZERO, Duration.ofSeconds(1));

        assertEquals(Duration.ZERO, policy.delayFor(3));
    }

    @Test
    void negativeAttemptReturnsZero() {
        assertEquals(Duration.ZERO, ExponentialBackoffPolicy.DEFAULT.delayFor(-1));
    }

    @Test
    void rejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class, () ->
                new ExponentialBackoffPolicy(Duration.ofSeconds(-1), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () ->
                new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(-1)));
    }

    @Test
    void rejectsNullDurations() {
        assertThrows(NullPointerException.class, () ->
                new ExponentialBackoffPolicy(null, Duration.ofSeconds(1)));
    }
}
