package io.chatsub;

/**
 * Thrown by a {@link io.chatsub.spi.SubscriptionSubmitter} when the remote side
 * rejected a subscription for a reason that retrying cannot fix (revoked
 * credentials, missing scopes, unknown channel).
 *
 * <p>The resubscribe path treats it as {@link SubscriptionOutcome#FAILED} and stops
 * retrying the affected channel.
 */
public class SubscriptionRejectedException extends RuntimeException {

    /**
     * @param message detail message
     */
    public SubscriptionRejectedException(String message) {
        super(message);
    }

    /**
     * @param message detail message
     * @param cause   the underlying cause
     */
    public SubscriptionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
