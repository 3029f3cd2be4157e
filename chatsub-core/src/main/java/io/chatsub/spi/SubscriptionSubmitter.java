package io.chatsub.spi;

/**
 * Requests and cancels chat-message subscriptions on the remote service.
 */
public interface SubscriptionSubmitter {

    /**
     * Requests an active chat-message subscription for the channel on behalf of the account.
     *
     * @param channelId     resolved channel identifier
     * @param accountUserId the subscribing account's user id
     * @return {@code true} if the subscription is active, {@code false} on any failure
     * @throws io.chatsub.SubscriptionRejectedException if retrying cannot help
     * @throws Exception for transport failures
     */
    boolean subscribeChat(String channelId, String accountUserId) throws Exception;

    /**
     * Cancels the chat-message subscription for the channel.
     *
     * <p>The default implementation does not support cancellation.
     *
     * @param channelId resolved channel identifier
     * @return {@code true} if a subscription was cancelled
     * @throws UnsupportedOperationException if the submitter cannot cancel subscriptions
     * @throws Exception for transport failures
     */
    default boolean unsubscribeChat(String channelId) throws Exception {
        throw new UnsupportedOperationException("unsubscribeChat not supported by " + getClass().getName());
    }
}
