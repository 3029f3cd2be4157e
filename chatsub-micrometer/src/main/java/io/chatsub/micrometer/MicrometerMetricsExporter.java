package io.chatsub.micrometer;

import io.chatsub.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code chatsub.subscribe.success}: subscriptions confirmed</li>
 *   <li>{@code chatsub.subscribe.failure}: subscriptions that ended unconfirmed</li>
 *   <li>{@code chatsub.subscribe.retry}: subscribe attempts followed by a backoff retry</li>
 *   <li>{@code chatsub.subscribe.exhausted}: channels whose retry budget ran out</li>
 *   <li>{@code chatsub.resolve.failure}: channel names that did not resolve to an id</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code chatsub.channels.joined}: size of the joined-channel set</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    /** Prefix used by {@link #MicrometerMetricsExporter(MeterRegistry)}. */
    public static final String DEFAULT_PREFIX = "chatsub";

    private final MeterRegistry registry;
    private final Counter subscribeSuccess;
    private final Counter subscribeFailure;
    private final Counter subscribeRetry;
    private final Counter subscribeExhausted;
    private final Counter resolveFailure;
    private final Gauge joinedChannelsGauge;

    private final AtomicInteger joinedChannels = new AtomicInteger();
    private volatile boolean closed;

    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix, for running several accounts in
     * one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "chatsub.bot1"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.subscribeSuccess = Counter.builder(namePrefix + ".subscribe.success")
                .description("Chat subscriptions confirmed")
                .register(registry);
        this.subscribeFailure = Counter.builder(namePrefix + ".subscribe.failure")
                .description("Chat subscriptions that ended unconfirmed")
                .register(registry);
        this.subscribeRetry = Counter.builder(namePrefix + ".subscribe.retry")
                .description("Subscribe attempts retried after backoff")
                .register(registry);
        this.subscribeExhausted = Counter.builder(namePrefix + ".subscribe.exhausted")
                .description("Channels whose resubscription retries ran out")
                .register(registry);
        this.resolveFailure = Counter.builder(namePrefix + ".resolve.failure")
                .description("Channel names that could not be resolved")
                .register(registry);
        this.joinedChannelsGauge = Gauge.builder(namePrefix + ".channels.joined", joinedChannels, AtomicInteger::get)
                .description("Channels currently joined")
                .register(registry);
    }

    @Override
    public void incrementSubscribeSuccess() {
        if (closed) return;
        subscribeSuccess.increment();
    }

    @Override
    public void incrementSubscribeFailure() {
        if (closed) return;
        subscribeFailure.increment();
    }

    @Override
    public void incrementSubscribeRetry() {
        if (closed) return;
        subscribeRetry.increment();
    }

    @Override
    public void incrementSubscribeExhausted() {
        if (closed) return;
        subscribeExhausted.increment();
    }

    @Override
    public void incrementResolveFailure() {
        if (closed) return;
        resolveFailure.increment();
    }

    @Override
    public void recordJoinedChannels(int count) {
        if (closed) return;
        joinedChannels.set(count);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the owning {@link io.chatsub.session.ChatSession} is closed so no
     * stale gauge keeps reporting.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(subscribeSuccess, subscribeFailure, subscribeRetry,
                subscribeExhausted, resolveFailure, joinedChannelsGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
