package io.chatsub.retry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded-attempt retry executor with pluggable backoff.
 *
 * <p>Each attempt invokes the operation with its zero-based index:
 * <ul>
 *   <li>a result without a retry request is returned at once as
 *       {@link RetryOutcome.Completed};</li>
 *   <li>a retry request, or an exception of a {@linkplain Builder#transientFailures
 *       transient kind}, waits {@code backoff(attempt)} and tries again;</li>
 *   <li>any other exception propagates immediately.</li>
 * </ul>
 * When the last attempt requests a retry the engine returns {@link RetryOutcome.Exhausted};
 * when the last attempt throws a transient exception, that exception propagates.
 *
 * <p>The engine holds no per-call state; one instance may be shared across threads.
 *
 * <pre>{@code
 * RetryEngine engine = RetryEngine.builder().maxAttempts(5).build();
 * RetryOutcome<Boolean> outcome = engine.execute(attempt -> {
 *     boolean ok = submitter.subscribeChat(channelId, userId);
 *     return ok ? AttemptResult.done(true) : AttemptResult.retry(false);
 * });
 * }</pre>
 */
public final class RetryEngine {
    private static final Logger logger = Logger.getLogger(RetryEngine.class.getName());

    /** Attempt ceiling used when the builder is not told otherwise. */
    public static final int DEFAULT_MAX_ATTEMPTS = 6;

    /**
     * Exception kinds retried by default: network and I/O errors ({@link IOException},
     * {@link UncheckedIOException}), runtime state errors ({@link IllegalStateException})
     * and bad-value errors ({@link IllegalArgumentException}).
     */
    public static final List<Class<? extends Exception>> DEFAULT_TRANSIENT_FAILURES = List.of(
            IOException.class,
            UncheckedIOException.class,
            IllegalStateException.class,
            IllegalArgumentException.class);

    private final int maxAttempts;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final List<Class<? extends Exception>> transientFailures;

    private RetryEngine(Builder builder) {
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
        }
        this.maxAttempts = builder.maxAttempts;
        this.backoffPolicy = Objects.requireNonNull(builder.backoffPolicy, "backoffPolicy");
        this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
        this.transientFailures = List.copyOf(builder.transientFailures);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs the operation until it completes or attempts run out.
     *
     * @param operation the operation to run
     * @param <T>       value type
     * @return the completed or exhausted outcome
     * @throws InterruptedException if a backoff wait was interrupted
     * @throws Exception            a non-transient exception from any attempt, or a transient
     *                              one from the last attempt
     */
    public <T> RetryOutcome<T> execute(RetryableOperation<T> operation) throws Exception {
        return execute(operation, RetryListener.noop());
    }

    /**
     * Runs the operation, reporting every attempt to the listener.
     *
     * @param operation the operation to run
     * @param listener  observer of individual attempts
     * @param <T>       value type
     * @return the completed or exhausted outcome
     * @throws InterruptedException if a backoff wait was interrupted
     * @throws Exception            a non-transient exception from any attempt, or a transient
     *                              one from the last attempt
     */
    public <T> RetryOutcome<T> execute(RetryableOperation<T> operation, RetryListener<T> listener)
            throws Exception {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(listener, "listener");

        T lastValue = null;
        Exception lastFailure = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            boolean lastAttempt = attempt == maxAttempts - 1;
            AttemptResult<T> result;
            try {
                result = operation.attempt(attempt);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                listener.onAttempt(RetryAttempt.threw(attempt, e));
                if (!isTransient(e) || lastAttempt) {
                    throw e;
                }
                lastFailure = e;
                logger.log(Level.FINE, "Attempt " + attempt + " failed transiently, retrying", e);
                pause(attempt);
                continue;
            }
            if (result == null) {
                throw new NullPointerException("Operation returned null on attempt " + attempt);
            }
            listener.onAttempt(RetryAttempt.returned(attempt, result));
            if (!result.shouldRetry()) {
                return new RetryOutcome.Completed<>(result.value(), attempt + 1);
            }
            lastValue = result.value();
            if (!lastAttempt) {
                pause(attempt);
            }
        }
        return new RetryOutcome.Exhausted<>(maxAttempts, lastValue, lastFailure);
    }

    private boolean isTransient(Exception e) {
        for (Class<? extends Exception> type : transientFailures) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    private void pause(int attempt) throws InterruptedException {
        Duration delay = backoffPolicy.delayFor(attempt);
        if (delay == null || delay.isNegative()) {
            throw new IllegalStateException("Backoff policy returned invalid delay " + delay
                    + " for attempt " + attempt);
        }
        if (!delay.isZero()) {
            sleeper.sleep(delay);
        }
    }

    /** Builder for {@link RetryEngine}. */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private BackoffPolicy backoffPolicy = ExponentialBackoffPolicy.DEFAULT;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private List<Class<? extends Exception>> transientFailures = DEFAULT_TRANSIENT_FAILURES;

        private Builder() {}

        /**
         * Sets the attempt ceiling.
         *
         * <p>Optional. Defaults to {@link RetryEngine#DEFAULT_MAX_ATTEMPTS}. Must be &ge; 1.
         *
         * @param maxAttempts maximum attempts per {@code execute} call
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the backoff between attempts.
         *
         * <p>Optional. Defaults to {@link ExponentialBackoffPolicy#DEFAULT}.
         *
         * @param backoffPolicy the backoff policy
         * @return this builder
         */
        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        /**
         * Sets how the engine waits between attempts.
         *
         * <p>Optional. Defaults to {@link Sleeper#SYSTEM}.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Replaces the exception kinds that are retried instead of propagated.
         *
         * <p>Optional. Defaults to {@link RetryEngine#DEFAULT_TRANSIENT_FAILURES}.
         *
         * @param transientFailures exception types; subclasses match too
         * @return this builder
         */
        public Builder transientFailures(List<Class<? extends Exception>> transientFailures) {
            Objects.requireNonNull(transientFailures, "transientFailures");
            transientFailures.forEach(type -> Objects.requireNonNull(type, "transientFailures element"));
            this.transientFailures = transientFailures;
            return this;
        }

        /**
         * Builds the engine.
         *
         * @return a new {@link RetryEngine}
         * @throws IllegalArgumentException if {@code maxAttempts < 1}
         * @throws NullPointerException     if the backoff policy or sleeper is null
         */
        public RetryEngine build() {
            return new RetryEngine(this);
        }
    }
}
