package io.nakama.client;

/**
 * Lifecycle of a {@link RealtimeConnection}. States only move forward; {@link #CLOSED} is terminal.
 */
public enum ConnectionState {
    /** Channel created and listeners bound, opening handshake not started. */
    NEW,
    CONNECTING,
    OPEN,
    CLOSED
}
