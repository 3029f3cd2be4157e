package io.chatsub.spi;

/**
 * Refreshes the account's access token when a lookup suggests it has expired.
 */
@FunctionalInterface
public interface TokenRefresher {

    /**
     * Refreshes the token. On success {@link AccountCredentials#accessToken()} returns
     * the new token.
     *
     * @return {@code true} if a fresh token is now available
     * @throws Exception if the refresh failed
     */
    boolean refreshToken() throws Exception;
}
