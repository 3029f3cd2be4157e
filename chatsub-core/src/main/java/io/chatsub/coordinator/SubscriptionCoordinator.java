package io.chatsub.coordinator;

import io.chatsub.Channel;
import io.chatsub.ChannelSet;
import io.chatsub.SubscriptionOutcome;
import io.chatsub.SubscriptionRejectedException;
import io.chatsub.retry.AttemptResult;
import io.chatsub.retry.RetryEngine;
import io.chatsub.retry.RetryOutcome;
import io.chatsub.spi.AccountCredentials;
import io.chatsub.spi.ChannelResolver;
import io.chatsub.spi.MetricsExporter;
import io.chatsub.spi.SubscriptionSubmitter;
import io.chatsub.spi.SubscriptionVerifier;
import io.chatsub.spi.TokenRefresher;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns channel names into confirmed chat subscriptions.
 *
 * <p>Entry points:
 * <ul>
 *   <li>{@link #subscribePrimaryChannel(Map)}: one subscribe call for the configured
 *       primary channel on startup.</li>
 *   <li>{@link #resubscribeAllChannels()}: after a reconnect, resolve and resubscribe
 *       every joined channel, retrying each through the context's
 *       {@link io.chatsub.retry.RetryEngine}. One failing channel never stops the others.</li>
 *   <li>{@link #joinChannel(String)} and {@link #leaveChannel(String)}: single-shot,
 *       idempotent membership changes that never throw.</li>
 * </ul>
 *
 * <p>Only {@code joinChannel} and {@code leaveChannel} modify the {@link ChannelSet}, and a
 * channel is appended only after its subscribe call returned success.
 */
public final class SubscriptionCoordinator {
    private static final Logger logger = Logger.getLogger(SubscriptionCoordinator.class.getName());

    private final SubscriptionContext context;
    private final ChannelSet channels;
    private final MetricsExporter metrics;

    public SubscriptionCoordinator(SubscriptionContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.channels = context.channels();
        this.metrics = context.metrics();
    }

    public SubscriptionContext context() {
        return context;
    }

    /**
     * Subscribes the primary channel with a single subscribe call.
     *
     * @param userIds channel ids keyed by normalized channel name
     * @return {@code true} if subscribed, or if no submitter is configured; {@code false} if
     *     no primary channel is configured, its id is missing, or the submitter said no
     * @throws Exception if the submitter failed
     */
    public boolean subscribePrimaryChannel(Map<String, String> userIds) throws Exception {
        Objects.requireNonNull(userIds, "userIds");
        SubscriptionSubmitter submitter = context.submitter();
        if (submitter == null) {
            return true;
        }
        Channel primary = context.primaryChannel();
        if (primary == null) {
            logger.warning("No primary channel configured");
            return false;
        }
        String channelId = userIds.get(primary.name());
        if (channelId == null || channelId.isBlank()) {
            logger.warning("No channel id known for primary channel " + primary);
            return false;
        }
        AccountCredentials credentials = context.credentials();
        boolean success = submitter.subscribeChat(channelId, credentials.userId());
        if (success) {
            metrics.incrementSubscribeSuccess();
            logger.info(credentials.username() + " joined " + primary);
        } else {
            metrics.incrementSubscribeFailure();
        }
        return success;
    }

    /**
     * Resolves and resubscribes every joined channel, in join order.
     *
     * <p>Each channel is independent: a resolution miss, an exhausted retry budget or an
     * exception marks the batch as failed and processing moves on to the next channel.
     * The channel set itself is not modified.
     *
     * @return {@code true} if every channel is subscribed again, or if no submitter or no
     *     resolver is configured
     */
    public boolean resubscribeAllChannels() {
        List<Channel> snapshot = channels.snapshot();
        logger.info("Starting resubscription for " + snapshot.size() + " channels: " + snapshot);
        if (context.submitter() == null || context.resolver() == null) {
            logger.warning("Resubscription skipped: submitter or resolver not configured");
            return true;
        }

        boolean allSuccess = true;
        for (Channel channel : snapshot) {
            try {
                if (!resubscribe(channel)) {
                    allSuccess = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Resubscription interrupted at " + channel + "; remaining channels skipped");
                return false;
            } catch (Exception e) {
                metrics.incrementSubscribeFailure();
                logger.log(Level.WARNING, "Failed to resolve or resubscribe to " + channel, e);
                allSuccess = false;
            }
        }
        logger.info("Resubscription completed: " + (allSuccess ? "success" : "partial failure"));
        return allSuccess;
    }

    private boolean resubscribe(Channel channel) throws Exception {
        String channelId = resolveChannelId(channel);
        if (channelId == null) {
            metrics.incrementResolveFailure();
            logger.warning("Could not resolve channel id for " + channel);
            return false;
        }

        SubscriptionSubmitter submitter = context.submitter();
        String userId = context.credentials().userId();
        RetryEngine retryEngine = context.retryEngine();
        RetryOutcome<SubscriptionOutcome> outcome = retryEngine.execute(
                attempt -> subscribeAttempt(submitter, channel, channelId, userId, attempt),
                attempt -> {
                    // the final attempt is never followed by a retry
                    if (attempt.retryRequested() && attempt.index() < retryEngine.maxAttempts() - 1) {
                        metrics.incrementSubscribeRetry();
                    }
                });

        if (outcome instanceof RetryOutcome.Exhausted<SubscriptionOutcome> exhausted) {
            metrics.incrementSubscribeExhausted();
            metrics.incrementSubscribeFailure();
            logger.warning("Failed to resubscribe to " + channel + " after "
                    + exhausted.attempts() + " attempts");
            return false;
        }
        SubscriptionOutcome result = ((RetryOutcome.Completed<SubscriptionOutcome>) outcome).value();
        if (result != SubscriptionOutcome.SUCCESS) {
            metrics.incrementSubscribeFailure();
            logger.warning("Subscription for " + channel + " was rejected");
            return false;
        }

        SubscriptionVerifier verifier = context.verifier();
        if (verifier != null && !verifier.activeChannelIds().contains(channelId)) {
            metrics.incrementSubscribeFailure();
            logger.warning("Subscription validation failed for " + channel + " (id " + channelId + ")");
            return false;
        }
        metrics.incrementSubscribeSuccess();
        logger.info("Resubscribed to " + channel);
        return true;
    }

    private static AttemptResult<SubscriptionOutcome> subscribeAttempt(
            SubscriptionSubmitter submitter, Channel channel, String channelId, String userId, int attempt)
            throws InterruptedException {
        try {
            boolean success = submitter.subscribeChat(channelId, userId);
            return success
                    ? AttemptResult.done(SubscriptionOutcome.SUCCESS)
                    : AttemptResult.retry(SubscriptionOutcome.RETRYABLE_FAILURE);
        } catch (SubscriptionRejectedException e) {
            logger.log(Level.WARNING, "Resubscription to " + channel + " rejected (attempt " + attempt + ")", e);
            return AttemptResult.done(SubscriptionOutcome.FAILED);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to resubscribe to " + channel + " (attempt " + attempt + ")", e);
            return AttemptResult.retry(SubscriptionOutcome.RETRYABLE_FAILURE);
        }
    }

    /**
     * Joins a channel: resolves its id and issues one subscribe call.
     *
     * <p>Joining a channel that is already joined succeeds without any remote call.
     * Exceptions are logged and reported as {@code false}.
     *
     * @param channelName raw channel name, with or without a leading {@code #}
     * @return {@code true} if the channel is joined
     */
    public boolean joinChannel(String channelName) {
        try {
            Channel channel = Channel.of(channelName);
            if (channels.contains(channel)) {
                return true;
            }
            String channelId = resolveChannelId(channel);
            if (channelId == null) {
                metrics.incrementResolveFailure();
                logger.warning("Could not resolve channel id for " + channel);
                return false;
            }
            SubscriptionSubmitter submitter = context.submitter();
            if (submitter == null) {
                return false;
            }
            AccountCredentials credentials = context.credentials();
            if (!submitter.subscribeChat(channelId, credentials.userId())) {
                metrics.incrementSubscribeFailure();
                logger.warning("Subscription for " + channel + " was not accepted");
                return false;
            }
            channels.add(channel);
            metrics.incrementSubscribeSuccess();
            metrics.recordJoinedChannels(channels.size());
            logger.info(credentials.username() + " joined " + channel);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Join channel interrupted: " + channelName);
            return false;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Join channel failed: " + channelName, e);
            return false;
        }
    }

    /**
     * Leaves a channel: cancels its subscription where possible and removes it from the
     * channel set.
     *
     * <p>A failed cancellation is logged and does not keep the channel in the set. Leaving a
     * channel that is not joined succeeds without any remote call.
     *
     * @param channelName raw channel name, with or without a leading {@code #}
     * @return {@code true} if the channel is no longer joined and no unexpected error occurred
     */
    public boolean leaveChannel(String channelName) {
        Channel channel;
        try {
            channel = Channel.of(channelName);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Leave channel failed: " + channelName, e);
            return false;
        }
        if (!channels.contains(channel)) {
            return true;
        }
        try {
            String channelId = resolveChannelId(channel);
            SubscriptionSubmitter submitter = context.submitter();
            if (submitter != null && channelId != null) {
                cancelSubscription(submitter, channel, channelId);
            }
            removeChannel(channel);
            logger.info(context.credentials().username() + " left " + channel);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            removeChannel(channel);
            logger.warning("Leave channel interrupted: " + channel);
            return false;
        } catch (Exception e) {
            removeChannel(channel);
            logger.log(Level.WARNING, "Leave channel failed: " + channel, e);
            return false;
        }
    }

    private static void cancelSubscription(SubscriptionSubmitter submitter, Channel channel, String channelId)
            throws InterruptedException {
        try {
            if (!submitter.unsubscribeChat(channelId)) {
                logger.warning("No active subscription to cancel for " + channel);
            }
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to unsubscribe from " + channel, e);
        }
    }

    private void removeChannel(Channel channel) {
        channels.remove(channel);
        metrics.recordJoinedChannels(channels.size());
    }

    private String resolveChannelId(Channel channel) throws Exception {
        String channelId = resolveWithTokenRefresh(List.of(channel.name())).get(channel.name());
        return channelId == null || channelId.isBlank() ? null : channelId;
    }

    /**
     * Resolves the names; if some are missing and a token refresher is configured, refreshes
     * the token once and resolves again.
     */
    private Map<String, String> resolveWithTokenRefresh(List<String> names) throws Exception {
        ChannelResolver resolver = context.resolver();
        if (resolver == null) {
            return Map.of();
        }
        Map<String, String> ids = resolve(resolver, names);
        TokenRefresher refresher = context.tokenRefresher();
        if (ids.keySet().containsAll(names) || refresher == null) {
            return ids;
        }
        logger.info("Attempting token refresh after incomplete channel resolution for " + names);
        if (!refresher.refreshToken()) {
            logger.warning("Token refresh failed; keeping partial resolution for " + names);
            return ids;
        }
        return resolve(resolver, names);
    }

    private Map<String, String> resolve(ChannelResolver resolver, List<String> names) throws Exception {
        AccountCredentials credentials = context.credentials();
        Map<String, String> ids = resolver.resolve(names, credentials.accessToken(), credentials.clientId());
        return ids != null ? ids : Map.of();
    }
}
