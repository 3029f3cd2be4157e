package io.chatsub.coordinator;

import io.chatsub.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

class CountingMetricsExporter implements MetricsExporter {
    final AtomicInteger success = new AtomicInteger();
    final AtomicInteger failure = new AtomicInteger();
    final AtomicInteger retry = new AtomicInteger();
    final AtomicInteger exhausted = new AtomicInteger();
    final AtomicInteger resolveFailure = new AtomicInteger();
    volatile int joinedChannels = -1;

    @Override
    public void incrementSubscribeSuccess() {
        success.incrementAndGet();
    }

    @Override
    public void incrementSubscribeFailure() {
        failure.incrementAndGet();
    }

    @Override
    public void incrementSubscribeRetry() {
        retry.incrementAndGet();
    }

    @Override
    public void incrementSubscribeExhausted() {
        exhausted.incrementAndGet();
    }

    @Override
    public void incrementResolveFailure() {
        resolveFailure.incrementAndGet();
    }

    @Override
    public void recordJoinedChannels(int count) {
        joinedChannels = count;
    }
}
