package io.chatsub.retry;

/**
 * One attempt observed by a {@link RetryListener}: its zero-based index and either the
 * result the operation returned or the exception it threw.
 *
 * @param index   zero-based attempt index
 * @param result  the returned result, or null if the attempt threw
 * @param failure the thrown exception, or null if the attempt returned
 * @param <T>     value type
 */
public record RetryAttempt<T>(int index, AttemptResult<T> result, Exception failure) {

    public RetryAttempt {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        if ((result == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of result and failure must be set");
        }
    }

    static <T> RetryAttempt<T> returned(int index, AttemptResult<T> result) {
        return new RetryAttempt<>(index, result, null);
    }

    static <T> RetryAttempt<T> threw(int index, Exception failure) {
        return new RetryAttempt<>(index, null, failure);
    }

    /**
     * Returns whether this attempt asked for, or forced, another attempt.
     *
     * @return {@code true} if the attempt threw or returned a retry request
     */
    public boolean retryRequested() {
        return failure != null || result.shouldRetry();
    }
}
