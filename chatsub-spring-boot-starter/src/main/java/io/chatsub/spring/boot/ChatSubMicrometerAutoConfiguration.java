package io.chatsub.spring.boot;

import io.chatsub.micrometer.MicrometerMetricsExporter;
import io.chatsub.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code chatsub.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link ChatSubAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the subscription context.
 */
@AutoConfiguration(before = ChatSubAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "chatsub.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ChatSubProperties.class)
public class ChatSubMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, ChatSubProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
