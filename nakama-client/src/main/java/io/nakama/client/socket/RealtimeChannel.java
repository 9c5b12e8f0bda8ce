package io.nakama.client.socket;

import java.util.concurrent.CompletableFuture;

/**
 * Abstract duplex channel carrying binary frames between client and server.
 *
 * <p>Events are reported to the {@link ChannelListener} bound when the channel was created.
 * Implementations deliver inbound frames one at a time, in the order received.
 */
public interface RealtimeChannel {

    /**
     * Starts the opening handshake.
     *
     * @return completes when the channel is open, or exceptionally if it could not be opened
     */
    CompletableFuture<Void> connect();

    /**
     * Queues a binary frame for writing. Safe to call from several threads.
     *
     * @return completes once the frame has been handed to the network
     */
    CompletableFuture<Void> send(byte[] frame);

    /**
     * Starts the closing handshake.
     *
     * @return completes once {@link ChannelListener#onClose} has been delivered
     */
    CompletableFuture<Void> close(int statusCode, String reason);

    /**
     * Drops the connection without a closing handshake.
     */
    void abort();
}
