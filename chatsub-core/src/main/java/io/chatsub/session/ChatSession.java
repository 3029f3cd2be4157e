package io.chatsub.session;

import io.chatsub.Channel;
import io.chatsub.ConnectionState;
import io.chatsub.coordinator.SubscriptionContext;
import io.chatsub.coordinator.SubscriptionCoordinator;
import io.chatsub.util.DaemonThreadFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Backend-side owner of one account's chat subscriptions.
 *
 * <p>The session holds the {@link ConnectionState} and runs every coordinator operation on a
 * single coordinating thread, so the shared {@link io.chatsub.ChannelSet} only ever has one
 * writer and operations complete in submission order. The transport layer reports
 * connectivity through {@link #markConnecting()}, {@link #markConnected()} and
 * {@link #markDisconnected()}; the session moves through {@link ConnectionState#JOINING}
 * to {@link ConnectionState#JOINED} as subscriptions are confirmed.
 *
 * <pre>{@code
 * try (ChatSession session = ChatSession.builder().coordinator(coordinator).build()) {
 *     session.markConnecting();
 *     session.markConnected();
 *     session.start(Map.of("mychannel", "1234")).join();
 *     session.join("#otherchannel").join();
 *     // transport dropped and came back
 *     session.handleReconnect().join();
 * }
 * }</pre>
 *
 * <p>{@link #close()} stops accepting work, lets queued operations finish within the drain
 * timeout, then interrupts the coordinating thread, which cancels an in-flight backoff wait.
 */
public final class ChatSession implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ChatSession.class.getName());

    private final SubscriptionCoordinator coordinator;
    private final ExecutorService executor;
    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final long drainTimeoutMs;

    private ChatSession(Builder builder) {
        this.coordinator = Objects.requireNonNull(builder.coordinator, "coordinator");
        if (builder.drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory(builder.threadNamePrefix));
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConnectionState state() {
        return state.get();
    }

    public SubscriptionCoordinator coordinator() {
        return coordinator;
    }

    public void markConnecting() {
        transition(ConnectionState.CONNECTING);
    }

    public void markConnected() {
        transition(ConnectionState.CONNECTED);
    }

    public void markDisconnected() {
        transition(ConnectionState.DISCONNECTED);
    }

    /**
     * Subscribes the primary channel once the transport is connected.
     *
     * <p>On a confirmed subscription the primary channel is recorded in the channel set so it
     * is recovered by later reconnects, and the session becomes {@link ConnectionState#JOINED}.
     * Otherwise it falls back to {@link ConnectionState#CONNECTED}; that includes the no-op
     * success reported when no submitter is configured, which records nothing.
     *
     * @param userIds channel ids keyed by normalized channel name
     * @return a future with the subscription result; completes exceptionally if the
     *     submitter threw
     */
    public CompletableFuture<Boolean> start(Map<String, String> userIds) {
        Objects.requireNonNull(userIds, "userIds");
        return submit("start", () -> {
            if (!beginJoining("start")) {
                return false;
            }
            boolean subscribed = false;
            try {
                boolean success = coordinator.subscribePrimaryChannel(userIds);
                // without a submitter success means "nothing to do", not a confirmed subscription
                subscribed = success && coordinator.context().submitter() != null;
                if (subscribed) {
                    recordPrimaryChannel();
                }
                return success;
            } finally {
                finishJoining(subscribed);
            }
        });
    }

    /**
     * Recovers all subscriptions after the transport reconnected.
     *
     * @return a future with the aggregate resubscription result
     */
    public CompletableFuture<Boolean> handleReconnect() {
        return submit("reconnect", () -> {
            if (!beginJoining("reconnect")) {
                return false;
            }
            boolean success = false;
            try {
                success = coordinator.resubscribeAllChannels();
                if (!success) {
                    logger.warning("Resubscription after reconnect finished with failures");
                }
                return success;
            } finally {
                finishJoining(success);
            }
        });
    }

    /**
     * Joins a channel.
     *
     * @param channelName raw channel name
     * @return a future with the join result; never completes exceptionally unless the
     *     session is closed
     */
    public CompletableFuture<Boolean> join(String channelName) {
        return submit("join " + channelName, () -> coordinator.joinChannel(channelName));
    }

    /**
     * Leaves a channel.
     *
     * @param channelName raw channel name
     * @return a future with the leave result
     */
    public CompletableFuture<Boolean> leave(String channelName) {
        return submit("leave " + channelName, () -> coordinator.leaveChannel(channelName));
    }

    private boolean beginJoining(String action) {
        ConnectionState current = state.get();
        while (current.isConnected()) {
            if (state.compareAndSet(current, ConnectionState.JOINING)) {
                if (current != ConnectionState.JOINING) {
                    logger.fine("Connection state " + current + " -> " + ConnectionState.JOINING);
                }
                return true;
            }
            current = state.get();
        }
        logger.warning("Cannot " + action + " while " + current);
        return false;
    }

    private void finishJoining(boolean success) {
        ConnectionState target = success ? ConnectionState.JOINED : ConnectionState.CONNECTED;
        // A disconnect reported meanwhile wins over the join result
        if (state.compareAndSet(ConnectionState.JOINING, target)) {
            logger.fine("Connection state JOINING -> " + target);
        }
    }

    private void recordPrimaryChannel() {
        SubscriptionContext context = coordinator.context();
        Channel primary = context.primaryChannel();
        if (primary != null && context.channels().add(primary)) {
            context.metrics().recordJoinedChannels(context.channels().size());
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state.getAndSet(next);
        if (previous != next) {
            logger.fine("Connection state " + previous + " -> " + next);
        }
    }

    private CompletableFuture<Boolean> submit(String action, Callable<Boolean> task) {
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        if (!accepting.get()) {
            future.completeExceptionally(new RejectedExecutionException("Session closed; cannot " + action));
            return future;
        }
        try {
            executor.execute(() -> {
                try {
                    future.complete(task.call());
                } catch (Throwable t) {
                    logger.log(Level.SEVERE, "Session operation failed: " + action, t);
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Stops accepting operations, drains queued ones within the drain timeout, then
     * interrupts whatever is still running.
     */
    @Override
    public void close() {
        accepting.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded; interrupting session operations");
                executor.shutdownNow();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        transition(ConnectionState.DISCONNECTED);
    }

    /** Builder for {@link ChatSession}. */
    public static final class Builder {
        private SubscriptionCoordinator coordinator;
        private long drainTimeoutMs = 5000;
        private String threadNamePrefix = "chatsub-session-";

        private Builder() {}

        /**
         * Sets the coordinator the session drives.
         *
         * <p><b>Required.</b>
         *
         * @param coordinator the subscription coordinator
         * @return this builder
         */
        public Builder coordinator(SubscriptionCoordinator coordinator) {
            this.coordinator = coordinator;
            return this;
        }

        /**
         * Sets how long {@link ChatSession#close()} waits for queued operations.
         *
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param drainTimeoutMs drain timeout in milliseconds
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Sets the name prefix of the coordinating thread.
         *
         * <p>Optional. Defaults to {@code "chatsub-session-"}.
         *
         * @param threadNamePrefix thread name prefix
         * @return this builder
         */
        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
            return this;
        }

        /**
         * Builds the session and starts its coordinating thread.
         *
         * @return a new {@link ChatSession} in state {@link ConnectionState#DISCONNECTED}
         * @throws NullPointerException     if {@code coordinator} is null
         * @throws IllegalArgumentException if {@code drainTimeoutMs < 0}
         */
        public ChatSession build() {
            return new ChatSession(this);
        }
    }
}
