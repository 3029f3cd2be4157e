package io.chatsub.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Waits between retry attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks the calling thread for {@link Duration#toMillis()} milliseconds.
     * Interrupting the thread aborts the wait.
     */
    Sleeper SYSTEM = delay -> TimeUnit.MILLISECONDS.sleep(delay.toMillis());

    /**
     * Waits for the given delay.
     *
     * @param delay how long to wait, never negative
     * @throws InterruptedException if the wait was cancelled
     */
    void sleep(Duration delay) throws InterruptedException;
}
