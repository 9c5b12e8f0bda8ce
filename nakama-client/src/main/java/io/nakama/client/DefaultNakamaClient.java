package io.nakama.client;

import io.nakama.client.socket.RealtimeChannelFactory;
import io.nakama.codec.spi.EnvelopeCodec;
import io.nakama.core.AuthenticateRequest;
import io.nakama.core.Envelope;
import io.nakama.core.NakamaException;
import io.nakama.core.Protocol;
import io.nakama.core.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

final class DefaultNakamaClient implements NakamaClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultNakamaClient.class);

    private final ClientConfig config;
    private final SessionAuthenticator authenticator;
    private final EnvelopeCodec codec;
    private final RealtimeChannelFactory channelFactory;
    private final Clock clock;
    private final ExecutorService ownedExecutor;
    private final List<ClientListener> listeners = new CopyOnWriteArrayList<>();
    private final Fanout fanout = new Fanout();

    private RealtimeConnection connection;
    private ServerClock lastClock;

    DefaultNakamaClient(ClientConfig config, SessionAuthenticator authenticator, EnvelopeCodec codec,
                        RealtimeChannelFactory channelFactory, Clock clock, ExecutorService ownedExecutor) {
        this.config = Objects.requireNonNull(config, "config");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownedExecutor = ownedExecutor;
        this.lastClock = new ServerClock(clock);
    }

    @Override
    public ClientConfig config() {
        return config;
    }

    @Override
    public CompletableFuture<Session> login(AuthenticateRequest request) {
        return authenticator.authenticate(Protocol.PATH_LOGIN, request);
    }

    @Override
    public CompletableFuture<Session> register(AuthenticateRequest request) {
        return authenticator.authenticate(Protocol.PATH_REGISTER, request);
    }

    @Override
    public void connect(Session session) {
        CompletableFuture<Void> opening = connectAsync(session);
        try {
            opening.get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            RealtimeConnection current = current();
            if (current != null) {
                current.abort();
            }
            throw new NakamaException.TransportFault("socket did not open within " + config.connectTimeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NakamaException.TransportFault("interrupted while connecting", e);
        } catch (ExecutionException e) {
            throw asNakama(Futures.unwrap(e));
        }
    }

    @Override
    public CompletableFuture<Void> connectAsync(Session session) {
        Objects.requireNonNull(session, "session");
        RealtimeConnection target;
        synchronized (this) {
            if (connection == null || connection.state() == ConnectionState.CLOSED) {
                connection = new RealtimeConnection(config, session, codec, channelFactory, clock, fanout);
                lastClock = connection.clock();
            } else {
                log.debug("Reusing realtime connection in state {}", connection.state());
            }
            target = connection;
        }
        return target.connect();
    }

    @Override
    public void disconnect() {
        CompletableFuture<Void> closing = disconnectAsync();
        try {
            closing.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NakamaException.TransportFault("interrupted while disconnecting", e);
        } catch (ExecutionException e) {
            throw asNakama(Futures.unwrap(e));
        }
    }

    @Override
    public CompletableFuture<Void> disconnectAsync() {
        RealtimeConnection current = current();
        if (current == null) {
            return CompletableFuture.completedFuture(null);
        }
        return current.disconnect();
    }

    @Override
    public <T> CompletableFuture<T> send(RealtimeMessage<T> message) {
        RealtimeConnection current = current();
        if (current == null) {
            return CompletableFuture.failedFuture(new NakamaException.InvalidState("not connected"));
        }
        return current.send(message);
    }

    @Override
    public long serverTime() {
        synchronized (this) {
            return lastClock.read();
        }
    }

    @Override
    public boolean isConnected() {
        RealtimeConnection current = current();
        return current != null && current.state() == ConnectionState.OPEN;
    }

    @Override
    public void addListener(ClientListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(ClientListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        RealtimeConnection current = current();
        if (current != null) {
            current.abort();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private synchronized RealtimeConnection current() {
        return connection;
    }

    private synchronized void release(RealtimeConnection closed) {
        if (connection == closed) {
            connection = null;
        }
    }

    private static NakamaException asNakama(Throwable t) {
        if (t instanceof NakamaException) {
            return (NakamaException) t;
        }
        return new NakamaException.TransportFault(t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName(), t);
    }

    /**
     * Forwards connection events to every registered listener. One failing listener does not
     * stop the others.
     */
    private final class Fanout implements ClientListener {

        @Override
        public void onDisconnect() {
            RealtimeConnection current = current();
            if (current != null && current.state() == ConnectionState.CLOSED) {
                release(current);
            }
            for (ClientListener listener : listeners) {
                try {
                    listener.onDisconnect();
                } catch (RuntimeException e) {
                    log.warn("Disconnect listener {} failed", listener, e);
                }
            }
        }

        @Override
        public void onMessage(Envelope envelope) {
            for (ClientListener listener : listeners) {
                try {
                    listener.onMessage(envelope);
                } catch (RuntimeException e) {
                    log.warn("Message listener {} failed", listener, e);
                }
            }
        }
    }
}
