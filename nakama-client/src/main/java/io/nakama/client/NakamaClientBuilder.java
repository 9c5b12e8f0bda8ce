package io.nakama.client;

import io.nakama.client.socket.JdkWebSocketChannel;
import io.nakama.client.socket.RealtimeChannelFactory;
import io.nakama.codec.spi.EnvelopeCodec;
import io.nakama.codec.spi.EnvelopeCodecs;
import io.nakama.http.spi.HttpClientAdapter;
import io.nakama.http.spi.JdkHttpClientAdapter;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a {@link NakamaClient}.
 *
 * <p>Configuration is captured when {@link #build()} runs; changing the builder afterwards does
 * not affect clients it already built. Collaborators left unset default to the JDK HTTP and
 * WebSocket clients, the codec found on the class path, and a private executor that the client
 * shuts down on {@link NakamaClient#close()}.
 */
public final class NakamaClientBuilder {

    private ClientConfig.Builder config;
    private HttpClientAdapter httpClient;
    private RealtimeChannelFactory channelFactory;
    private EnvelopeCodec codec;
    private Executor executor;
    private Clock clock = Clock.systemUTC();

    NakamaClientBuilder(ClientConfig config) {
        this.config = Objects.requireNonNull(config, "config").toBuilder();
    }

    public NakamaClientBuilder config(ClientConfig config) {
        this.config = Objects.requireNonNull(config, "config").toBuilder();
        return this;
    }

    public NakamaClientBuilder host(String host) {
        config.host(host);
        return this;
    }

    public NakamaClientBuilder port(int port) {
        config.port(port);
        return this;
    }

    public NakamaClientBuilder ssl(boolean ssl) {
        config.ssl(ssl);
        return this;
    }

    public NakamaClientBuilder lang(String lang) {
        config.lang(lang);
        return this;
    }

    public NakamaClientBuilder connectTimeout(Duration connectTimeout) {
        config.connectTimeout(connectTimeout);
        return this;
    }

    public NakamaClientBuilder timeout(Duration timeout) {
        config.timeout(timeout);
        return this;
    }

    public NakamaClientBuilder requestTimeout(Duration requestTimeout) {
        config.requestTimeout(requestTimeout);
        return this;
    }

    public NakamaClientBuilder trace(boolean trace) {
        config.trace(trace);
        return this;
    }

    public NakamaClientBuilder httpClient(HttpClientAdapter httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    public NakamaClientBuilder channelFactory(RealtimeChannelFactory channelFactory) {
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        return this;
    }

    public NakamaClientBuilder codec(EnvelopeCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    /**
     * Executor for authentication exchanges. The caller keeps ownership.
     */
    public NakamaClientBuilder executor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        return this;
    }

    public NakamaClientBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public NakamaClient build() {
        ClientConfig resolved = config.build();

        HttpClientAdapter http = httpClient;
        RealtimeChannelFactory channels = channelFactory;
        if (http == null || channels == null) {
            HttpClient jdk = HttpClient.newBuilder()
                    .connectTimeout(resolved.connectTimeout())
                    .build();
            if (http == null) {
                http = JdkHttpClientAdapter.create(jdk);
            }
            if (channels == null) {
                channels = JdkWebSocketChannel.factory(jdk, resolved.connectTimeout(), resolved.timeout(), resolved.trace());
            }
        }

        EnvelopeCodec resolvedCodec = codec != null ? codec : EnvelopeCodecs.discover();

        ExecutorService owned = null;
        Executor exec = executor;
        if (exec == null) {
            owned = Executors.newCachedThreadPool(daemonThreads("nakama-auth"));
            exec = owned;
        }

        SessionAuthenticator authenticator = new SessionAuthenticator(resolved, http, resolvedCodec, exec, clock);
        return new DefaultNakamaClient(resolved, authenticator, resolvedCodec, channels, clock, owned);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
