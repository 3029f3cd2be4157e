package io.chatsub;

/**
 * Connectivity phases of a chat backend.
 *
 * <p>Owned by the backend ({@link io.chatsub.session.ChatSession}); the coordinator
 * never reads or writes it.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    JOINING,
    JOINED;

    /**
     * Returns whether the transport is up, regardless of subscription progress.
     *
     * @return {@code true} for {@link #CONNECTED}, {@link #JOINING} and {@link #JOINED}
     */
    public boolean isConnected() {
        return this == CONNECTED || this == JOINING || this == JOINED;
    }
}
