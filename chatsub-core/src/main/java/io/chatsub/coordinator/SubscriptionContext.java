package io.chatsub.coordinator;

import io.chatsub.Channel;
import io.chatsub.ChannelSet;
import io.chatsub.retry.RetryEngine;
import io.chatsub.spi.AccountCredentials;
import io.chatsub.spi.ChannelResolver;
import io.chatsub.spi.MetricsExporter;
import io.chatsub.spi.SubscriptionSubmitter;
import io.chatsub.spi.SubscriptionVerifier;
import io.chatsub.spi.TokenRefresher;

import java.util.Objects;

/**
 * Everything a {@link SubscriptionCoordinator} works with, fixed at construction.
 *
 * <p>Optional capabilities are {@code null} when not configured; the coordinator treats a
 * missing submitter or resolver as "feature not enabled", not as an error.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SubscriptionContext {

    /** Attempts per channel when resubscribing after a reconnect. */
    public static final int RESUBSCRIBE_MAX_ATTEMPTS = 5;

    private final AccountCredentials credentials;
    private final ChannelSet channels;
    private final Channel primaryChannel;
    private final ChannelResolver resolver;
    private final SubscriptionSubmitter submitter;
    private final TokenRefresher tokenRefresher;
    private final SubscriptionVerifier verifier;
    private final RetryEngine retryEngine;
    private final MetricsExporter metrics;

    private SubscriptionContext(Builder builder) {
        this.credentials = Objects.requireNonNull(builder.credentials, "credentials");
        this.channels = builder.channels != null ? builder.channels : new ChannelSet();
        this.primaryChannel = builder.primaryChannel;
        this.resolver = builder.resolver;
        this.submitter = builder.submitter;
        this.tokenRefresher = builder.tokenRefresher;
        this.verifier = builder.verifier;
        this.retryEngine = builder.retryEngine != null
                ? builder.retryEngine : RetryEngine.builder().maxAttempts(RESUBSCRIBE_MAX_ATTEMPTS).build();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    public AccountCredentials credentials() {
        return credentials;
    }

    public ChannelSet channels() {
        return channels;
    }

    /** @return the primary channel, or null if none is configured */
    public Channel primaryChannel() {
        return primaryChannel;
    }

    /** @return the resolver, or null if none is configured */
    public ChannelResolver resolver() {
        return resolver;
    }

    /** @return the submitter, or null if none is configured */
    public SubscriptionSubmitter submitter() {
        return submitter;
    }

    /** @return the token refresher, or null if none is configured */
    public TokenRefresher tokenRefresher() {
        return tokenRefresher;
    }

    /** @return the verifier, or null if none is configured */
    public SubscriptionVerifier verifier() {
        return verifier;
    }

    public RetryEngine retryEngine() {
        return retryEngine;
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    /** Builder for {@link SubscriptionContext}. */
    public static final class Builder {
        private AccountCredentials credentials;
        private ChannelSet channels;
        private Channel primaryChannel;
        private ChannelResolver resolver;
        private SubscriptionSubmitter submitter;
        private TokenRefresher tokenRefresher;
        private SubscriptionVerifier verifier;
        private RetryEngine retryEngine;
        private MetricsExporter metrics;

        private Builder() {}

        /**
         * Sets the account the backend subscribes for.
         *
         * <p><b>Required.</b>
         *
         * @param credentials the account credentials
         * @return this builder
         */
        public Builder credentials(AccountCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        /**
         * Sets the channel set shared with the owning backend.
         *
         * <p>Optional. Defaults to a new, empty {@link ChannelSet}.
         *
         * @param channels the joined channels
         * @return this builder
         */
        public Builder channels(ChannelSet channels) {
            this.channels = channels;
            return this;
        }

        /**
         * Sets the channel subscribed on startup.
         *
         * <p>Optional. Without it {@link SubscriptionCoordinator#subscribePrimaryChannel}
         * fails whenever a submitter is configured.
         *
         * @param primaryChannel raw channel name; normalized here
         * @return this builder
         */
        public Builder primaryChannel(String primaryChannel) {
            this.primaryChannel = primaryChannel == null ? null : Channel.of(primaryChannel);
            return this;
        }

        /**
         * Sets the channel id resolver.
         *
         * <p>Optional.
         *
         * @param resolver the resolver
         * @return this builder
         */
        public Builder resolver(ChannelResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * Sets the subscription submitter.
         *
         * <p>Optional.
         *
         * @param submitter the submitter
         * @return this builder
         */
        public Builder submitter(SubscriptionSubmitter submitter) {
            this.submitter = submitter;
            return this;
        }

        /**
         * Sets the token refresher used when a resolution comes back incomplete.
         *
         * <p>Optional.
         *
         * @param tokenRefresher the token refresher
         * @return this builder
         */
        public Builder tokenRefresher(TokenRefresher tokenRefresher) {
            this.tokenRefresher = tokenRefresher;
            return this;
        }

        /**
         * Sets the verifier consulted after each successful resubscription.
         *
         * <p>Optional. Without it a successful subscribe call is taken at its word.
         *
         * @param verifier the verifier
         * @return this builder
         */
        public Builder verifier(SubscriptionVerifier verifier) {
            this.verifier = verifier;
            return this;
        }

        /**
         * Sets the retry engine used for resubscription.
         *
         * <p>Optional. Defaults to {@link SubscriptionContext#RESUBSCRIBE_MAX_ATTEMPTS} attempts with
         * exponential backoff.
         *
         * @param retryEngine the retry engine
         * @return this builder
         */
        public Builder retryEngine(RetryEngine retryEngine) {
            this.retryEngine = retryEngine;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the context.
         *
         * @return a new {@link SubscriptionContext}
         * @throws NullPointerException if {@code credentials} is null
         */
        public SubscriptionContext build() {
            return new SubscriptionContext(this);
        }
    }
}
