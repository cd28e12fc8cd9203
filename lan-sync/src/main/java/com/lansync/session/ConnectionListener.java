package com.lansync.session;

/**
 * Connection lifecycle events surfaced to the lobby/session logic.
 *
 * All callbacks run on the network I/O thread and must return quickly. They must not call
 * blocking methods of the connection that raised them (e.g. {@code shutdown()}).
 * Every connection produces exactly one "gone" event ({@link #playerLeft} on the host,
 * {@link #connectionLost} on a client), whatever the cause.
 */
public interface ConnectionListener {

    /**
     * Host side: a client connected and was given {@code slot}.
     */
    default void playerJoined(int slot, String address) {
    }

    /**
     * Host side: the client in {@code slot} is gone and its slot is free again.
     */
    default void playerLeft(int slot) {
    }

    /**
     * Client side: the link to the host is gone.
     */
    default void connectionLost(String reason) {
    }
}
