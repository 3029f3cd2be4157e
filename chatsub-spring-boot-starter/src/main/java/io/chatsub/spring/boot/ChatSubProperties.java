package io.chatsub.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for chat subscription management.
 *
 * @see ChatSubAutoConfiguration
 */
@ConfigurationProperties(prefix = "chatsub")
public class ChatSubProperties {

    /**
     * Channel subscribed when the session starts, with or without a leading '#'.
     */
    private String primaryChannel;

    private final Retry retry = new Retry();
    private final Session session = new Session();
    private final Metrics metrics = new Metrics();

    public String getPrimaryChannel() {
        return primaryChannel;
    }

    public void setPrimaryChannel(String primaryChannel) {
        this.primaryChannel = primaryChannel;
    }

    public Retry getRetry() {
        return retry;
    }

    public Session getSession() {
        return session;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        /**
         * Subscribe attempts per channel when resubscribing after a reconnect.
         */
        private int maxAttempts = 5;

        /**
         * Wait after the first failed attempt; doubles on every further attempt.
         */
        private Duration baseDelay = Duration.ofSeconds(1);

        /**
         * Upper bound for a single wait.
         */
        private Duration maxDelay = Duration.ofSeconds(60);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Session {
        /**
         * How long closing the session waits for queued operations.
         */
        private Duration drainTimeout = Duration.ofSeconds(5);

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Metrics {
        /**
         * Whether to register Micrometer meters when Micrometer is present.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "chatsub";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
