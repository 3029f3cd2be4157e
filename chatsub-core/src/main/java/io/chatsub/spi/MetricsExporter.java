package io.chatsub.spi;

/**
 * Observability hook for exporting subscription counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of subscriptions that became active.
     */
    void incrementSubscribeSuccess();

    /**
     * Increments the count of subscribe operations that ended without an active subscription.
     */
    void incrementSubscribeFailure();

    /**
     * Increments the count of subscribe attempts that requested another attempt.
     */
    void incrementSubscribeRetry();

    /**
     * Increments the count of channels whose retry budget ran out.
     */
    void incrementSubscribeExhausted();

    /**
     * Increments the count of channel names that could not be resolved.
     */
    void incrementResolveFailure();

    /**
     * Records how many channels the backend is joined to.
     *
     * @param count current channel set size
     */
    default void recordJoinedChannels(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSubscribeSuccess() {
        }

        @Override
        public void incrementSubscribeFailure() {
        }

        @Override
        public void incrementSubscribeRetry() {
        }

        @Override
        public void incrementSubscribeExhausted() {
        }

        @Override
        public void incrementResolveFailure() {
        }
    }
}
