package io.chatsub.retry;

/**
 * An operation executed by {@link RetryEngine}.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    /**
     * Runs one attempt.
     *
     * @param attempt zero-based attempt index
     * @return the attempt's value and whether to retry, never null
     * @throws Exception transient failures are retried, others propagate
     */
    AttemptResult<T> attempt(int attempt) throws Exception;
}
