package io.chatsub.retry;

import java.time.Duration;

/**
 * Strategy for computing the wait between two attempts of a {@link RetryEngine}.
 *
 * @see ExponentialBackoffPolicy
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * Computes the delay to wait after the given attempt failed.
     *
     * @param attempt the zero-based index of the attempt that just failed
     * @return the delay, never null or negative
     */
    Duration delayFor(int attempt);
}
