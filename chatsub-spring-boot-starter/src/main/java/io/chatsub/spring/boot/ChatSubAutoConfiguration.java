package io.chatsub.spring.boot;

import io.chatsub.ChannelSet;
import io.chatsub.coordinator.SubscriptionContext;
import io.chatsub.coordinator.SubscriptionCoordinator;
import io.chatsub.retry.ExponentialBackoffPolicy;
import io.chatsub.retry.RetryEngine;
import io.chatsub.session.ChatSession;
import io.chatsub.spi.AccountCredentials;
import io.chatsub.spi.ChannelResolver;
import io.chatsub.spi.MetricsExporter;
import io.chatsub.spi.SubscriptionSubmitter;
import io.chatsub.spi.SubscriptionVerifier;
import io.chatsub.spi.TokenRefresher;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for chat subscription management.
 *
 * <p>Activates when the application defines an {@link AccountCredentials} bean. Resolver,
 * submitter, token refresher, verifier and metrics exporter beans are picked up when present;
 * any that are missing leave the corresponding capability disabled.
 *
 * @see ChatSubProperties
 * @see ChatSubMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(SubscriptionCoordinator.class)
@ConditionalOnBean(AccountCredentials.class)
@EnableConfigurationProperties(ChatSubProperties.class)
public class ChatSubAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ChannelSet chatChannels() {
        return new ChannelSet();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryEngine chatRetryEngine(ChatSubProperties props) {
        ChatSubProperties.Retry retry = props.getRetry();
        return RetryEngine.builder()
                .maxAttempts(retry.getMaxAttempts())
                .backoffPolicy(new ExponentialBackoffPolicy(retry.getBaseDelay(), retry.getMaxDelay()))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionContext subscriptionContext(ChatSubProperties props,
            AccountCredentials credentials,
            ChannelSet chatChannels,
            RetryEngine chatRetryEngine,
            ObjectProvider<ChannelResolver> resolverProvider,
            ObjectProvider<SubscriptionSubmitter> submitterProvider,
            ObjectProvider<TokenRefresher> tokenRefresherProvider,
            ObjectProvider<SubscriptionVerifier> verifierProvider,
            ObjectProvider<MetricsExporter> metricsProvider) {
        return SubscriptionContext.builder()
                .credentials(credentials)
                .channels(chatChannels)
                .primaryChannel(props.getPrimaryChannel())
                .resolver(resolverProvider.getIfAvailable())
                .submitter(submitterProvider.getIfAvailable())
                .tokenRefresher(tokenRefresherProvider.getIfAvailable())
                .verifier(verifierProvider.getIfAvailable())
                .retryEngine(chatRetryEngine)
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionCoordinator subscriptionCoordinator(SubscriptionContext subscriptionContext) {
        return new SubscriptionCoordinator(subscriptionContext);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ChatSession chatSession(ChatSubProperties props, SubscriptionCoordinator subscriptionCoordinator) {
        return ChatSession.builder()
                .coordinator(subscriptionCoordinator)
                .drainTimeoutMs(props.getSession().getDrainTimeout().toMillis())
                .build();
    }
}
