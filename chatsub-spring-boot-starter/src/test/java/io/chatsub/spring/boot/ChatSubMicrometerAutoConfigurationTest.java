package io.chatsub.spring.boot;

import io.chatsub.coordinator.SubscriptionContext;
import io.chatsub.micrometer.MicrometerMetricsExporter;
import io.chatsub.spi.AccountCredentials;
import io.chatsub.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatSubMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ChatSubMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("chatsub.metrics.name-prefix=bot.chat").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("bot.chat.subscribe.success").counter());
            assertNotNull(registry.find("bot.chat.channels.joined").gauge());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("chatsub.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void exporterFeedsSubscriptionContext() {
        runner.withConfiguration(AutoConfigurations.of(ChatSubAutoConfiguration.class))
                .withUserConfiguration(CredentialsConfig.class)
                .run(ctx -> assertSame(ctx.getBean(MicrometerMetricsExporter.class),
                        ctx.getBean(SubscriptionContext.class).metrics()));
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }

    @Configuration
    static class CredentialsConfig {
        @Bean
        AccountCredentials accountCredentials() {
            return AccountCredentials.of("token", "client", "42", "bot");
        }
    }
}
