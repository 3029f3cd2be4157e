package io.chatsub.retry;

/**
 * What a {@link RetryableOperation} reports after one attempt: a value and whether the
 * engine should try again.
 *
 * @param value       the attempt's value; may be null
 * @param shouldRetry {@code true} to request another attempt
 * @param <T>         value type
 */
public record AttemptResult<T>(T value, boolean shouldRetry) {

    /**
     * Final result; the engine returns it without further attempts.
     *
     * @param value the value to return
     * @param <T>   value type
     * @return a non-retrying result
     */
    public static <T> AttemptResult<T> done(T value) {
        return new AttemptResult<>(value, false);
    }

    /**
     * Requests another attempt, remembering the value in case attempts run out.
     *
     * @param value the value seen on this attempt
     * @param <T>   value type
     * @return a retrying result
     */
    public static <T> AttemptResult<T> retry(T value) {
        return new AttemptResult<>(value, true);
    }
}
