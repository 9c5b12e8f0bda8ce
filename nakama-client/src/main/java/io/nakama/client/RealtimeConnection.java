package io.nakama.client;

import io.nakama.client.socket.ChannelListener;
import io.nakama.client.socket.RealtimeChannel;
import io.nakama.client.socket.RealtimeChannelFactory;
import io.nakama.codec.spi.CodecException;
import io.nakama.codec.spi.EnvelopeCodec;
import io.nakama.core.Envelope;
import io.nakama.core.NakamaException;
import io.nakama.core.Payload;
import io.nakama.core.Protocol;
import io.nakama.core.Session;
import io.nakama.core.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One realtime connection: the channel, its correlation table and its server clock, with a
 * single lifecycle.
 *
 * <p>The channel is created, and its listeners bound, when the connection is constructed.
 * Once {@link ConnectionState#CLOSED} the connection cannot be reopened; construct a new one.
 *
 * <p>Thread-safety: {@link #send} may be called from any thread. Inbound frames are processed
 * on the channel's receiving thread, one at a time.
 */
public final class RealtimeConnection {

    private static final Logger log = LoggerFactory.getLogger(RealtimeConnection.class);

    private final ClientConfig config;
    private final EnvelopeCodec codec;
    private final ClientListener events;
    private final CorrelationTable table = new CorrelationTable();
    private final ServerClock clock;
    private final EnvelopeDispatcher dispatcher;
    private final RealtimeChannel channel;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.NEW);
    private final CompletableFuture<Void> opened = new CompletableFuture<>();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private volatile ScheduledExecutorService sweeper;

    RealtimeConnection(ClientConfig config, Session session, EnvelopeCodec codec,
                       RealtimeChannelFactory channelFactory, Clock wallClock, ClientListener events) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = new ServerClock(wallClock);
        this.dispatcher = new EnvelopeDispatcher(table, clock, this::onPush, config.trace());
        this.channel = channelFactory.create(socketUri(config, session), new Events());
    }

    static URI socketUri(ClientConfig config, Session session) {
        Objects.requireNonNull(session, "session");
        URI base = Urls.endpoint(config.socketScheme(), config.host(), config.port(), Protocol.PATH_REALTIME);
        return Urls.withQuery(base, Map.of(
                Protocol.Q_SERVER_KEY, config.serverKey(),
                Protocol.Q_TOKEN, session.token(),
                Protocol.Q_LANG, config.lang()
        ));
    }

    public ConnectionState state() {
        return state.get();
    }

    public long serverTime() {
        return clock.read();
    }

    ServerClock clock() {
        return clock;
    }

    int pendingCount() {
        return table.size();
    }

    /**
     * Starts the opening handshake. Calling it again returns the same future.
     *
     * @return completes when the connection is open
     */
    public CompletableFuture<Void> connect() {
        if (state.compareAndSet(ConnectionState.NEW, ConnectionState.CONNECTING)) {
            log.debug("Connecting to {}://{}:{}", config.socketScheme(), config.host(), config.port());
            channel.connect().whenComplete((ok, err) -> {
                if (err != null) {
                    Throwable cause = Futures.unwrap(err);
                    opened.completeExceptionally(new NakamaException.TransportFault(
                            "socket connect failed: " + describe(cause), cause));
                }
            });
            return opened;
        }
        if (state.get() == ConnectionState.CLOSED && !opened.isDone()) {
            opened.completeExceptionally(new NakamaException.InvalidState("connection is closed"));
        }
        return opened;
    }

    /**
     * Sends a request and returns its reply.
     *
     * <p>The future fails with {@link NakamaException.ProtocolError} if the server replies with
     * an error, {@link NakamaException.TransportFault} if the frame could not be written,
     * {@link NakamaException.Disconnected} if the connection closes first, and
     * {@link NakamaException.RequestTimeout} if a request deadline is configured and passes.
     */
    public <T> CompletableFuture<T> send(RealtimeMessage<T> message) {
        Objects.requireNonNull(message, "message");
        ConnectionState current = state.get();
        if (current != ConnectionState.OPEN) {
            return CompletableFuture.failedFuture(new NakamaException.InvalidState("connection is " + current));
        }

        String collationId = UUID.randomUUID().toString();
        PendingRequest request = new PendingRequest(collationId, deadline());
        try {
            table.insert(request);
        } catch (NakamaException e) {
            return CompletableFuture.failedFuture(e);
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(new NakamaException.InvalidState(e.getMessage()));
        }
        CompletableFuture<T> reply = request.result().thenApply(message::cast);

        Envelope envelope = new Envelope(collationId, message.payload());
        byte[] frame;
        try {
            frame = codec.writeBytes(envelope);
        } catch (CodecException e) {
            failPending(collationId, new NakamaException.TransportFault("failed to encode " + envelope.kind(), e));
            return reply;
        }

        if (config.trace()) {
            log.trace("SocketWrite: {}", envelope);
        }
        channel.send(frame).whenComplete((ok, err) -> {
            if (err != null) {
                Throwable cause = Futures.unwrap(err);
                failPending(collationId, new NakamaException.TransportFault("socket write failed: " + describe(cause), cause));
            }
        });
        return reply;
    }

    /**
     * Sends a logout message if open, then closes the channel with a normal status.
     *
     * @return completes once the connection is closed
     */
    public CompletableFuture<Void> disconnect() {
        ConnectionState current = state.get();
        if (current == ConnectionState.CLOSED) {
            return closed;
        }
        if (current == ConnectionState.OPEN) {
            sendLogout();
        }
        channel.close(Protocol.CLOSE_NORMAL, "");
        return closed;
    }

    /**
     * Drops the channel without a closing handshake. Pending requests fail as on any closure.
     */
    public void abort() {
        channel.abort();
    }

    private void sendLogout() {
        byte[] frame;
        try {
            frame = codec.writeBytes(Envelope.of(new Payload.Logout()));
        } catch (CodecException e) {
            log.warn("Failed to encode logout message", e);
            return;
        }
        channel.send(frame).whenComplete((ok, err) -> {
            if (err != null) {
                log.debug("Logout message not sent: {}", describe(Futures.unwrap(err)));
            }
        });
    }

    private long deadline() {
        Duration timeout = config.requestTimeout();
        return timeout == null ? PendingRequest.NO_DEADLINE : System.nanoTime() + timeout.toNanos();
    }

    private void failPending(String collationId, NakamaException error) {
        PendingRequest request = table.remove(collationId);
        if (request != null) {
            request.fail(error);
        }
    }

    private void startSweeper() {
        Duration timeout = config.requestTimeout();
        if (timeout == null) {
            return;
        }
        long period = Math.max(10, Math.min(1000, timeout.toMillis() / 4));
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "nakama-request-sweeper");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::sweep, period, period, TimeUnit.MILLISECONDS);
        sweeper = executor;
    }

    private void sweep() {
        List<PendingRequest> expired = table.expire(System.nanoTime());
        for (PendingRequest request : expired) {
            log.debug("Request {} timed out", request.id());
            request.fail(new NakamaException.RequestTimeout(
                    "no reply within " + config.requestTimeout().toMillis() + "ms"));
        }
    }

    private void onPush(Envelope envelope) {
        try {
            events.onMessage(envelope);
        } catch (RuntimeException e) {
            log.warn("Message listener failed", e);
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private final class Events implements ChannelListener {

        @Override
        public void onOpen() {
            if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
                return;
            }
            log.debug("Socket open");
            startSweeper();
            opened.complete(null);
        }

        @Override
        public void onMessage(byte[] frame) {
            Envelope envelope;
            try {
                envelope = codec.readValue(frame, Envelope.class);
            } catch (CodecException e) {
                log.warn("Dropping undecodable frame ({} bytes): {}", frame.length, e.getMessage());
                return;
            }
            if (config.trace()) {
                log.trace("SocketDecoded: {}", envelope);
            }
            dispatcher.dispatch(envelope);
        }

        @Override
        public void onClose(int statusCode, String reason) {
            if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
                return;
            }
            log.debug("Socket closed: status={} reason={}", statusCode, reason);
            ScheduledExecutorService executor = sweeper;
            if (executor != null) {
                executor.shutdownNow();
            }

            String message = "connection closed (" + statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason) + ")";
            for (PendingRequest request : table.drain()) {
                request.fail(new NakamaException.Disconnected(message));
            }
            if (!opened.isDone()) {
                opened.completeExceptionally(new NakamaException.TransportFault("socket closed before open: " + message));
            }
            try {
                events.onDisconnect();
            } catch (RuntimeException e) {
                log.warn("Disconnect listener failed", e);
            } finally {
                closed.complete(null);
            }
        }
    }
}
