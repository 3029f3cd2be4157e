/**
 * Micrometer bridge for chat subscription metrics.
 *
 * <p>Provides {@link io.chatsub.micrometer.MicrometerMetricsExporter}, which implements
 * {@link io.chatsub.spi.MetricsExporter} by registering counters and a joined-channel gauge
 * with a Micrometer {@link io.micrometer.core.instrument.MeterRegistry}.
 */
package io.chatsub.micrometer;
