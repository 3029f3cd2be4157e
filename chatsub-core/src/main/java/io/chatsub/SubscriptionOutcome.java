package io.chatsub;

/**
 * Result of a single subscribe attempt.
 */
public enum SubscriptionOutcome {
    /** The subscription is active. */
    SUCCESS,
    /** The submitter refused the subscription; retrying will not help. */
    FAILED,
    /** The attempt failed in a way that may succeed on a later attempt. */
    RETRYABLE_FAILURE;

    /**
     * Returns whether a retry engine should attempt again after this outcome.
     *
     * @return {@code true} only for {@link #RETRYABLE_FAILURE}
     */
    public boolean shouldRetry() {
        return this == RETRYABLE_FAILURE;
    }
}
