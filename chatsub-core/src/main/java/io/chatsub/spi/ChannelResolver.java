package io.chatsub.spi;

import java.util.List;
import java.util.Map;

/**
 * Resolves channel names to the stable numeric identifiers the chat service
 * subscribes by.
 */
@FunctionalInterface
public interface ChannelResolver {

    /**
     * Resolves a batch of normalized channel names.
     *
     * @param channelNames normalized names to resolve
     * @param authToken    current access token
     * @param clientId     application client id
     * @return identifiers keyed by normalized name; a name missing from the map could not
     *     be resolved
     * @throws Exception if the lookup failed as a whole
     */
    Map<String, String> resolve(List<String> channelNames, String authToken, String clientId)
            throws Exception;
}
