package io.nakama.client;

import io.nakama.client.socket.ChannelListener;
import io.nakama.client.socket.RealtimeChannel;
import io.nakama.client.socket.RealtimeChannelFactory;
import io.nakama.core.Protocol;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory channel that records writes and lets a test play the server side.
 */
final class FakeChannel implements RealtimeChannel {

    final URI uri;
    final ChannelListener listener;
    final List<byte[]> frames = Collections.synchronizedList(new ArrayList<>());
    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    volatile boolean openOnConnect = true;
    volatile boolean failWrites;
    private final AtomicBoolean closed = new AtomicBoolean();

    FakeChannel(URI uri, ChannelListener listener) {
        this.uri = uri;
        this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> connect() {
        events.add("connect");
        if (openOnConnect) {
            listener.onOpen();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> send(byte[] frame) {
        if (failWrites) {
            events.add("send-failed");
            return CompletableFuture.failedFuture(new IOException("broken pipe"));
        }
        events.add("send");
        frames.add(frame);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> close(int statusCode, String reason) {
        events.add("close:" + statusCode);
        peerClosed(statusCode, reason);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void abort() {
        events.add("abort");
        peerClosed(Protocol.CLOSE_ABNORMAL, "aborted");
    }

    void open() {
        listener.onOpen();
    }

    void receive(byte[] frame) {
        listener.onMessage(frame);
    }

    void peerClosed(int statusCode, String reason) {
        if (closed.compareAndSet(false, true)) {
            listener.onClose(statusCode, reason);
        }
    }

    byte[] frame(int index) {
        return frames.get(index);
    }

    /**
     * Remembers every channel it creates.
     */
    static final class Factory implements RealtimeChannelFactory {
        final List<FakeChannel> created = Collections.synchronizedList(new ArrayList<>());
        volatile boolean openOnConnect = true;

        @Override
        public RealtimeChannel create(URI uri, ChannelListener listener) {
            FakeChannel channel = new FakeChannel(uri, listener);
            channel.openOnConnect = openOnConnect;
            created.add(channel);
            return channel;
        }

        FakeChannel last() {
            return created.get(created.size() - 1);
        }
    }
}
