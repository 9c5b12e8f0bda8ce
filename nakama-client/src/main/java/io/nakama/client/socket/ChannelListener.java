package io.nakama.client.socket;

/**
 * Receives the lifecycle events of a {@link RealtimeChannel}.
 */
public interface ChannelListener {

    void onOpen();

    void onMessage(byte[] frame);

    /**
     * Called exactly once when the channel closes, whoever initiated it.
     */
    void onClose(int statusCode, String reason);
}
