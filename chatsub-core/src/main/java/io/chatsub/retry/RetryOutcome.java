package io.chatsub.retry;

/**
 * Terminal result of {@link RetryEngine#execute(RetryableOperation)}.
 *
 * <ul>
 *   <li>{@link Completed}: an attempt returned without requesting a retry.</li>
 *   <li>{@link Exhausted}: every attempt requested a retry; carries the attempt count
 *       and the last value and failure seen, so running out of attempts is never
 *       confused with an operation that returned a negative value.</li>
 * </ul>
 *
 * @param <T> value type
 */
public sealed interface RetryOutcome<T> permits RetryOutcome.Completed, RetryOutcome.Exhausted {

    /**
     * Returns the number of attempts made.
     *
     * @return attempts, at least 1
     */
    int attempts();

    /**
     * Returns whether an attempt completed.
     *
     * @return {@code true} for {@link Completed}
     */
    default boolean isCompleted() {
        return this instanceof Completed;
    }

    /**
     * An attempt returned a final value.
     *
     * @param value    the value returned by the final attempt; may be null
     * @param attempts attempts made, including the final one
     * @param <T>      value type
     */
    record Completed<T>(T value, int attempts) implements RetryOutcome<T> {
    }

    /**
     * All attempts were used up.
     *
     * @param attempts    attempts made; equals the configured maximum
     * @param lastValue   value of the last attempt that returned, or null
     * @param lastFailure last transient exception that was retried, or null
     * @param <T>         value type
     */
    record Exhausted<T>(int attempts, T lastValue, Exception lastFailure) implements RetryOutcome<T> {
    }
}
