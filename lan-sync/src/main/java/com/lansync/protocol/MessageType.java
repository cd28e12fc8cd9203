package com.lansync.protocol;

/**
 * Defines all message types for the game link.
 *
 * Client → Host:
 * - INPUT: Direction change for the client's entity
 * - READY: Client is ready to start
 *
 * Host → Client:
 * - WORLD_SNAPSHOT: Complete world state for one tick
 * - GAME_START: Session is starting
 * - GAME_END: Session has ended, with winner and scores
 * - PLAYER_ASSIGNED: Entity the client controls
 * - LOBBY_STATE: Lobby settings and connected count
 * - RETURN_TO_LOBBY: Leave the running session
 *
 * Bidirectional:
 * - PING / PONG: Keep-alive and round-trip measurement
 * - DISCONNECT: Planned disconnect, the receiver closes the link
 */
public enum MessageType {
    // Client → Host
    INPUT,
    READY,

    // Host → Client
    WORLD_SNAPSHOT,
    GAME_START,
    GAME_END,
    PLAYER_ASSIGNED,
    LOBBY_STATE,
    RETURN_TO_LOBBY,

    // Bidirectional
    PING,
    PONG,
    DISCONNECT
}
