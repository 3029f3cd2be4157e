package io.chatsub.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryEngineTest {

    private final RecordingSleeper sleeper = new RecordingSleeper();

    private RetryEngine engine(int maxAttempts) {
        return RetryEngine.builder()
                .maxAttempts(maxAttempts)
                .sleeper(sleeper)
                .build();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMaxAttemptsLessThanOne() {
        assertThrows(IllegalArgumentException.class, () ->
                RetryEngine.builder().maxAttempts(0).build());
    }

    @Test
    void builderRejectsNullBackoffPolicy() {
        assertThrows(NullPointerException.class, () ->
                RetryEngine.builder().backoffPolicy(null).build());
    }

    @Test
    void builderRejectsNullSleeper() {
        assertThrows(NullPointerException.class, () ->
                RetryEngine.builder().sleeper(null).build());
    }

    @Test
    void builderRejectsNullTransientFailureElement() {
        List<Class<? extends Exception>> types = new ArrayList<>();
        types.add(null);
        assertThrows(NullPointerException.class, () ->
                RetryEngine.builder().transientFailures(types));
    }

    @Test
    void defaultsToSixAttempts() {
        assertEquals(RetryEngine.DEFAULT_MAX_ATTEMPTS, RetryEngine.builder().build().maxAttempts());
    }

    // ── Completion ──────────────────────────────────────────────────

    @Test
    void returnsFirstNonRetryResultWithoutSleeping() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        RetryOutcome<String> outcome = engine(5).execute(attempt -> {
            calls.incrementAndGet();
            return AttemptResult.done("ok");
        });

        var completed = assertInstanceOf(RetryOutcome.Completed.class, outcome);
        assertEquals("ok", completed.value());
        assertEquals(1, completed.attempts());
        assertEquals(1, calls.get());
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void completedFalseIsNotExhaustion() throws Exception {
        RetryOutcome<Boolean> outcome = engine(3).execute(attempt -> AttemptResult.done(false));

        assertTrue(outcome.isCompleted());
        assertFalse(((RetryOutcome.Completed<Boolean>) outcome).value());
    }

    @Test
    void retriesUntilOperationStopsAsking() throws Exception {
        RetryOutcome<Integer> outcome = engine(5).execute(attempt ->
                attempt < 2 ? AttemptResult.retry(attempt) : AttemptResult.done(attempt));

        var completed = assertInstanceOf(RetryOutcome.Completed.class, outcome);
        assertEquals(2, completed.value());
        assertEquals(3, completed.attempts());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.delays());
    }

    @Test
    void passesZeroBasedIncreasingAttemptIndexes() throws Exception {
        List<Integer> seen = new ArrayList<>();

        engine(4).execute(attempt -> {
            seen.add(attempt);
            return AttemptResult.retry(null);
        });

        assertEquals(List.of(0, 1, 2, 3), seen);
    }

    // ── Exhaustion ──────────────────────────────────────────────────

    @Test
    void exhaustionCarriesAttemptCountAndLastValue() throws Exception {
        RetryOutcome<String> outcome = engine(5).execute(attempt -> AttemptResult.retry("try-" + attempt));

        assertFalse(outcome.isCompleted());
        var exhausted = assertInstanceOf(RetryOutcome.Exhausted.class, outcome);
        assertEquals(5, exhausted.attempts());
        assertEquals("try-4", exhausted.lastValue());
        assertNull(exhausted.lastFailure());
    }

    @Test
    void defaultBackoffBetweenAttemptsAndNoSleepAfterLast() throws Exception {
        engine(4).execute(attempt -> AttemptResult.retry(null));

        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)),
                sleeper.delays());
    }

    @Test
    void singleAttemptExhaustsWithoutSleeping() throws Exception {
        RetryOutcome<Object> outcome = engine(1).execute(attempt -> AttemptResult.retry(null));

        assertEquals(1, outcome.attempts());
        assertFalse(outcome.isCompleted());
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void exhaustionRemembersLastSwallowedFailure() throws Exception {
        IOException failure = new IOException("reset");

        RetryOutcome<String> outcome = engine(3).execute(attempt -> {
            if (attempt == 0) {
                throw failure;
            }
            return AttemptResult.retry("no");
        });

        var exhausted = assertInstanceOf(RetryOutcome.Exhausted.class, outcome);
        assertSame(failure, exhausted.lastFailure());
        assertEquals("no", exhausted.lastValue());
    }

    // ── Exceptions ──────────────────────────────────────────────────

    @Test
    void transientExceptionsAreRetried() throws Exception {
        List<Exception> failures = List.of(
                new ConnectException("refused"),
                new UncheckedIOException(new IOException("eof")),
                new IllegalStateException("runtime"),
                new IllegalArgumentException("value"));

        RetryOutcome<String> outcome = engine(5).execute(attempt -> {
            if (attempt < failures.size()) {
                throw failures.get(attempt);
            }
            return AttemptResult.done("recovered");
        });

        var completed = assertInstanceOf(RetryOutcome.Completed.class, outcome);
        assertEquals("recovered", completed.value());
        assertEquals(5, completed.attempts());
        assertEquals(4, sleeper.delays().size());
    }

    @Test
    void transientExceptionOnLastAttemptPropagates() {
        IOException last = new IOException("still down");
        AtomicInteger calls = new AtomicInteger();

        IOException thrown = assertThrows(IOException.class, () -> engine(3).execute(attempt -> {
            calls.incrementAndGet();
            throw attempt == 2 ? last : new IOException("down");
        }));

        assertSame(last, thrown);
        assertEquals(3, calls.get());
        assertEquals(2, sleeper.delays().size());
    }

    @Test
    void nonTransientExceptionPropagatesImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(UnsupportedOperationException.class, () -> engine(5).execute(attempt -> {
            calls.incrementAndGet();
            throw new UnsupportedOperationException("nope");
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void customTransientFailuresReplaceDefaults() {
        RetryEngine engine = RetryEngine.builder()
                .maxAttempts(3)
                .sleeper(sleeper)
                .transientFailures(List.of(UnsupportedOperationException.class))
                .build();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IOException.class, () -> engine.execute(attempt -> {
            calls.incrementAndGet();
            throw new IOException("not transient any more");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void nullResultIsRejected() {
        assertThrows(NullPointerException.class, () -> engine(3).execute(attempt -> null));
    }

    // ── Backoff and cancellation ────────────────────────────────────

    @Test
    void customBackoffReceivesAttemptIndex() throws Exception {
        List<Integer> asked = new ArrayList<>();
        RetryEngine engine = RetryEngine.builder()
                .maxAttempts(3)
                .sleeper(sleeper)
                .backoffPolicy(attempt -> {
                    asked.add(attempt);
                    return Duration.ofMillis(10L * (attempt + 1));
                })
                .build();

        engine.execute(attempt -> AttemptResult.retry(null));

        assertEquals(List.of(0, 1), asked);
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeper.delays());
    }

    @Test
    void zeroDelayDoesNotSleep() throws Exception {
        RetryEngine engine = RetryEngine.builder()
                .maxAttempts(3)
                .sleeper(sleeper)
                .backoffPolicy(attempt -> Duration.ZERO)
                .build();

        engine.execute(attempt -> AttemptResult.retry(null));

        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void negativeBackoffIsRejected() {
        RetryEngine engine = RetryEngine.builder()
                .maxAttempts(3)
                .sleeper(sleeper)
                .backoffPolicy(attempt -> Duration.ofSeconds(-1))
                .build();

        assertThrows(IllegalStateException.class, () -> engine.execute(attempt -> AttemptResult.retry(null)));
    }

    @Test
    void interruptedWaitAbortsExecution() {
        AtomicInteger calls = new AtomicInteger();
        RetryEngine engine = RetryEngine.builder()
                .maxAttempts(5)
                .sleeper(delay -> {
                    throw new InterruptedException("cancelled");
                })
                .build();

        assertThrows(InterruptedException.class, () -> engine.execute(attempt -> {
            calls.incrementAndGet();
            return AttemptResult.retry(null);
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void interruptedExceptionFromOperationIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(InterruptedException.class, () -> engine(5).execute(attempt -> {
            calls.incrementAndGet();
            throw new InterruptedException();
        }));
        assertEquals(1, calls.get());
    }

    // ── Listener ────────────────────────────────────────────────────

    @Test
    void listenerSeesEveryAttemptInOrder() throws Exception {
        List<RetryAttempt<String>> attempts = new ArrayList<>();

        engine(5).execute(attempt -> {
            if (attempt == 0) {
                throw new IOException("flaky");
            }
            return attempt == 1 ? AttemptResult.retry("again") : AttemptResult.done("done");
        }, attempts::add);

        assertEquals(3, attempts.size());
        assertEquals(0, attempts.get(0).index());
        assertInstanceOf(IOException.class, attempts.get(0).failure());
        assertTrue(attempts.get(0).retryRequested());
        assertEquals("again", attempts.get(1).result().value());
        assertTrue(attempts.get(1).retryRequested());
        assertEquals(2, attempts.get(2).index());
        assertFalse(attempts.get(2).retryRequested());
    }

    @Test
    void retryAttemptRequiresExactlyOneOfResultAndFailure() {
        assertThrows(IllegalArgumentException.class, () -> new RetryAttempt<String>(0, null, null));
        assertThrows(IllegalArgumentException.class, () ->
                new RetryAttempt<>(0, AttemptResult.done("x"), new IOException()));
        assertThrows(IllegalArgumentException.class, () ->
                new RetryAttempt<>(-1, AttemptResult.done("x"), null));
    }
}
