package io.chatsub.spi;

import java.util.Objects;

/**
 * Identity of the chat account a backend subscribes for.
 *
 * <p>Read on every remote call, so an implementation backed by a token store picks up
 * refreshed tokens without rebuilding the coordinator.
 */
public interface AccountCredentials {

    String accessToken();

    String clientId();

    /** The account's own user id, sent with every subscription. */
    String userId();

    /** Display name used in log messages. */
    String username();

    /**
     * Fixed credentials.
     *
     * @param accessToken access token
     * @param clientId    application client id
     * @param userId      account user id
     * @param username    account display name
     * @return immutable credentials
     * @throws NullPointerException if any argument is null
     */
    static AccountCredentials of(String accessToken, String clientId, String userId, String username) {
        return new Fixed(accessToken, clientId, userId, username);
    }

    /** Immutable {@link AccountCredentials}. */
    record Fixed(String accessToken, String clientId, String userId, String username)
            implements AccountCredentials {
        public Fixed {
            Objects.requireNonNull(accessToken, "accessToken");
            Objects.requireNonNull(clientId, "clientId");
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(username, "username");
        }

        @Override
        public String toString() {
            return "AccountCredentials[username=" + username + ", userId=" + userId + "]";
        }
    }
}
