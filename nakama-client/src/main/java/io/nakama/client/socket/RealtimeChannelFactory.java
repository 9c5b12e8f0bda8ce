package io.nakama.client.socket;

import java.net.URI;

/**
 * Creates channels bound to a listener. Each call returns a new, unconnected channel.
 */
@FunctionalInterface
public interface RealtimeChannelFactory {

    RealtimeChannel create(URI uri, ChannelListener listener);
}
