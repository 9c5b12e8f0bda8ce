package io.nakama.client.socket;

import io.nakama.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link RealtimeChannel} over the JDK 11+ {@link WebSocket} client.
 *
 * <p>Inbound frames are requested one at a time and the next frame is only requested once the
 * listener has returned, so frames reach the listener strictly in order. The JDK client allows a
 * single outstanding send, so outbound frames and the close frame are chained in call order.
 * Text frames and pings are not part of the protocol and are ignored.
 */
public final class JdkWebSocketChannel implements RealtimeChannel {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketChannel.class);

    private final HttpClient httpClient;
    private final URI uri;
    private final ChannelListener listener;
    private final Duration connectTimeout;
    private final Duration closeTimeout;
    private final boolean trace;

    private final AtomicReference<WebSocket> socket = new AtomicReference<>();
    private final AtomicBoolean connectStarted = new AtomicBoolean();
    private final AtomicBoolean closeDelivered = new AtomicBoolean();
    private final CompletableFuture<Void> opened = new CompletableFuture<>();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    private final Object writeLock = new Object();
    private CompletableFuture<?> writeTail = CompletableFuture.completedFuture(null);

    public JdkWebSocketChannel(HttpClient httpClient, URI uri, ChannelListener listener,
                               Duration connectTimeout, Duration closeTimeout, boolean trace) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
        this.trace = trace;
    }

    /**
     * Creates a factory sharing one HttpClient across channels.
     *
     * @param connectTimeout bound on the opening handshake
     * @param closeTimeout how long to wait for the peer's close frame before aborting
     */
    public static RealtimeChannelFactory factory(HttpClient httpClient, Duration connectTimeout,
                                                 Duration closeTimeout, boolean trace) {
        return (uri, listener) -> new JdkWebSocketChannel(httpClient, uri, listener, connectTimeout, closeTimeout, trace);
    }

    @Override
    public CompletableFuture<Void> connect() {
        if (!connectStarted.compareAndSet(false, true)) {
            return opened;
        }
        if (closeDelivered.get()) {
            opened.completeExceptionally(new IllegalStateException("channel already closed"));
            return opened;
        }
        httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new Receiver())
                .whenComplete((ws, err) -> {
                    if (err != null) {
                        Throwable cause = unwrap(err);
                        log.debug("WebSocket connect to {}{} failed", uri.getHost(), uri.getPath(), cause);
                        opened.completeExceptionally(cause);
                        deliverClose(Protocol.CLOSE_ABNORMAL, describe(cause));
                    } else {
                        socket.compareAndSet(null, ws);
                        opened.complete(null);
                    }
                });
        return opened;
    }

    @Override
    public CompletableFuture<Void> send(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        WebSocket ws = socket.get();
        if (ws == null || closeDelivered.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("channel is not open"));
        }
        synchronized (writeLock) {
            CompletableFuture<Void> next = writeTail
                    .handle((r, e) -> null)
                    .thenCompose(ignored -> ws.sendBinary(ByteBuffer.wrap(frame), true))
                    .thenApply(w -> (Void) null);
            writeTail = next;
            return next;
        }
    }

    @Override
    public CompletableFuture<Void> close(int statusCode, String reason) {
        WebSocket ws = socket.get();
        if (ws == null) {
            deliverClose(statusCode, reason);
            return closed;
        }
        if (closed.isDone()) {
            return closed;
        }
        CompletableFuture<WebSocket> sent;
        synchronized (writeLock) {
            sent = writeTail
                    .handle((r, e) -> null)
                    .thenCompose(ignored -> ws.sendClose(statusCode, reason == null ? "" : reason));
            writeTail = sent;
        }
        sent.whenComplete((w, err) -> {
            if (err != null) {
                log.debug("Sending close frame failed; aborting", unwrap(err));
                ws.abort();
                deliverClose(Protocol.CLOSE_ABNORMAL, describe(unwrap(err)));
                return;
            }
            CompletableFuture.delayedExecutor(closeTimeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
                if (!closed.isDone()) {
                    log.debug("No close frame from peer within {}; aborting", closeTimeout);
                    ws.abort();
                    deliverClose(statusCode, reason);
                }
            });
        });
        return closed;
    }

    @Override
    public void abort() {
        WebSocket ws = socket.get();
        if (ws != null) {
            ws.abort();
        }
        deliverClose(Protocol.CLOSE_ABNORMAL, "aborted");
    }

    private void deliverClose(int statusCode, String reason) {
        if (!closeDelivered.compareAndSet(false, true)) {
            return;
        }
        try {
            listener.onClose(statusCode, reason);
        } finally {
            closed.complete(null);
        }
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private final class Receiver implements WebSocket.Listener {
        // only touched from the listener's serial callbacks
        private ByteArrayOutputStream partial;

        @Override
        public void onOpen(WebSocket webSocket) {
            socket.compareAndSet(null, webSocket);
            if (closeDelivered.get()) {
                // closed while the handshake was in flight
                webSocket.abort();
                return;
            }
            listener.onOpen();
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            if (!last) {
                if (partial == null) {
                    partial = new ByteArrayOutputStream();
                }
                partial.write(chunk, 0, chunk.length);
                webSocket.request(1);
                return null;
            }

            byte[] frame = chunk;
            if (partial != null) {
                partial.write(chunk, 0, chunk.length);
                frame = partial.toByteArray();
                partial = null;
            }
            try {
                listener.onMessage(frame);
            } catch (RuntimeException e) {
                log.warn("Inbound frame handler failed", e);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            if (trace) {
                log.trace("SocketReceive: Invalid content (text/plain).");
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            if (trace) {
                log.trace("SocketReceive: WebSocket ping.");
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            deliverClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.debug("WebSocket error", error);
            deliverClose(Protocol.CLOSE_ABNORMAL, describe(error));
        }
    }
}
