package io.chatsub.spi;

import java.util.Set;

/**
 * Lists the channels the remote service currently delivers messages for.
 */
@FunctionalInterface
public interface SubscriptionVerifier {

    /**
     * Returns the identifiers of all channels with an active subscription in this session.
     *
     * @return active channel identifiers, never null
     * @throws Exception if the listing failed
     */
    Set<String> activeChannelIds() throws Exception;
}
