package io.nakama.client;

import io.nakama.core.Envelope;

/**
 * Receives connection-level events from a {@link NakamaClient}.
 *
 * <p>Callbacks run on the socket's receiving thread and should return quickly.
 */
public interface ClientListener {

    /**
     * The realtime connection closed, whether the caller or the peer initiated it.
     */
    default void onDisconnect() {}

    /**
     * An unsolicited message arrived: a server push that is not a reply to a request.
     */
    default void onMessage(Envelope envelope) {}
}
