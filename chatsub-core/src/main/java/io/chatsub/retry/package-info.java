/**
 * Generic bounded-attempt retry with backoff.
 *
 * <p>{@link io.chatsub.retry.RetryEngine} knows nothing about subscriptions. Operations
 * report {@link io.chatsub.retry.AttemptResult}s; the engine ends with a typed
 * {@link io.chatsub.retry.RetryOutcome}, so exhaustion is always distinguishable from a
 * completed attempt.
 *
 * @see io.chatsub.retry.RetryEngine
 * @see io.chatsub.retry.ExponentialBackoffPolicy
 */
package io.chatsub.retry;
