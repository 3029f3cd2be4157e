package io.chatsub.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff that doubles with every attempt: {@code baseDelay * 2^attempt}, capped at
 * {@code maxDelay}.
 *
 * <p>{@link #DEFAULT} yields 1s, 2s, 4s, 8s ... up to 60s.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

    /** {@code min(2^attempt, 60)} seconds. */
    public static final ExponentialBackoffPolicy DEFAULT =
            new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60));

    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * @param baseDelay delay after the first failed attempt
     * @param maxDelay  upper bound for any delay
     * @throws NullPointerException     if either argument is null
     * @throws IllegalArgumentException if either argument is negative
     */
    public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay) {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0, got: " + baseDelay);
        }
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be >= 0, got: " + maxDelay);
        }
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
    }

    @Override
    public Duration delayFor(int attempt) {
        if (attempt < 0 || baseDelayMs == 0) {
            return Duration.ZERO;
        }
        long expDelay;
        if (attempt >= 62) {
            expDelay = Long.MAX_VALUE;
        } else {
            long factor = 1L << attempt;
            // Cap before multiplying to stay clear of overflow
            expDelay = factor > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * factor;
        }
        return Duration.ofMillis(Math.min(maxDelayMs, expDelay));
    }

    @Override
    public String toString() {
        return "ExponentialBackoffPolicy[base=" + baseDelayMs + "ms, max=" + maxDelayMs + "ms]";
    }
}
