package io.nakama.client;

import io.nakama.core.AuthenticateRequest;
import io.nakama.core.Session;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Client for a Nakama server: HTTP authentication plus one realtime connection at a time.
 *
 * <p>Asynchronous operations return a {@link CompletableFuture} that completes exceptionally with
 * a {@link io.nakama.core.NakamaException}. Each also has a callback form built on that future.
 */
public interface NakamaClient extends AutoCloseable {

    ClientConfig config();

    CompletableFuture<Session> login(AuthenticateRequest request);

    CompletableFuture<Session> register(AuthenticateRequest request);

    default void login(AuthenticateRequest request, Consumer<Session> onSuccess, Consumer<Throwable> onFailure) {
        Futures.deliver(login(request), onSuccess, onFailure);
    }

    default void register(AuthenticateRequest request, Consumer<Session> onSuccess, Consumer<Throwable> onFailure) {
        Futures.deliver(register(request), onSuccess, onFailure);
    }

    /**
     * Opens the realtime connection and waits for it, bounded by the connect timeout.
     * An already open connection is reused.
     *
     * @throws io.nakama.core.NakamaException.TransportFault if the connection does not open in time
     */
    void connect(Session session);

    CompletableFuture<Void> connectAsync(Session session);

    default void connect(Session session, Runnable onOpen, Consumer<Throwable> onFailure) {
        Futures.deliver(connectAsync(session), ignored -> onOpen.run(), onFailure);
    }

    /**
     * Logs out and closes the realtime connection, waiting for the close to finish.
     * Does nothing if no connection is open.
     */
    void disconnect();

    CompletableFuture<Void> disconnectAsync();

    default void disconnect(Runnable onClosed) {
        disconnectAsync().whenComplete((ok, err) -> onClosed.run());
    }

    <T> CompletableFuture<T> send(RealtimeMessage<T> message);

    default <T> void send(RealtimeMessage<T> message, Consumer<? super T> onSuccess, Consumer<Throwable> onFailure) {
        Futures.deliver(send(message), onSuccess, onFailure);
    }

    /**
     * Server time in epoch milliseconds, as advanced by heartbeats. Falls back to the local
     * clock until a heartbeat has been seen.
     */
    long serverTime();

    boolean isConnected();

    void addListener(ClientListener listener);

    void removeListener(ClientListener listener);

    /**
     * Aborts any open connection and releases owned resources.
     */
    @Override
    void close();

    static NakamaClient create(String serverKey) {
        return builder(serverKey).build();
    }

    static NakamaClientBuilder builder(String serverKey) {
        return new NakamaClientBuilder(ClientConfig.builder(serverKey).build());
    }

    static NakamaClientBuilder builder(ClientConfig config) {
        return new NakamaClientBuilder(config);
    }
}
