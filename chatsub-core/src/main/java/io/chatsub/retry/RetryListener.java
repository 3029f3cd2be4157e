package io.chatsub.retry;

/**
 * Callback invoked by {@link RetryEngine} after every attempt, before any wait.
 *
 * @param <T> value type of the observed operation
 */
@FunctionalInterface
public interface RetryListener<T> {

    /**
     * Listener that ignores all attempts.
     *
     * @param <T> value type
     * @return a no-op listener
     */
    static <T> RetryListener<T> noop() {
        return attempt -> { };
    }

    /**
     * Called once per attempt, in attempt order.
     *
     * @param attempt the attempt that just finished
     */
    void onAttempt(RetryAttempt<T> attempt);
}
