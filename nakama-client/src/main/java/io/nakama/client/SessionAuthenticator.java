package io.nakama.client;

import io.nakama.codec.spi.CodecException;
import io.nakama.codec.spi.EnvelopeCodec;
import io.nakama.core.AuthenticateRequest;
import io.nakama.core.AuthenticateResponse;
import io.nakama.core.NakamaException;
import io.nakama.core.Protocol;
import io.nakama.core.Session;
import io.nakama.core.Urls;
import io.nakama.http.spi.HttpClientAdapter;
import io.nakama.http.spi.HttpClientException;
import io.nakama.http.spi.HttpClientRequest;
import io.nakama.http.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Exchanges credentials for a {@link Session} over a single HTTP request.
 */
final class SessionAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticator.class);

    static final String USER_AGENT = "nakama-java/" + version();

    private final ClientConfig config;
    private final HttpClientAdapter http;
    private final EnvelopeCodec codec;
    private final Executor executor;
    private final Clock clock;
    private final String authorization;

    SessionAuthenticator(ClientConfig config, HttpClientAdapter http, EnvelopeCodec codec, Executor executor, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((config.serverKey() + ":").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Runs the exchange on the executor.
     *
     * @param path {@link Protocol#PATH_LOGIN} or {@link Protocol#PATH_REGISTER}
     * @return completes with the session, or exceptionally with a {@link NakamaException}
     */
    CompletableFuture<Session> authenticate(String path, AuthenticateRequest request) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(request, "request");
        CompletableFuture<Session> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(exchange(path, request));
                } catch (NakamaException e) {
                    result.completeExceptionally(e);
                } catch (RuntimeException e) {
                    result.completeExceptionally(new NakamaException.TransportFault(describe(e), e));
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new NakamaException.TransportFault("authentication not scheduled: " + describe(e), e));
        }
        return result;
    }

    private Session exchange(String path, AuthenticateRequest request) {
        long createdAt = clock.millis();
        AuthenticateRequest tagged = request.withCollationId(UUID.randomUUID().toString());
        URI uri = Urls.endpoint(config.httpScheme(), config.host(), config.port(), path);

        byte[] body;
        try {
            body = codec.writeBytes(tagged);
        } catch (CodecException e) {
            throw new NakamaException.TransportFault("failed to encode authentication request", e);
        }

        HttpClientRequest httpRequest = HttpClientRequest.post(uri)
                .header(Protocol.H_CONTENT_TYPE, codec.contentType())
                .header(Protocol.H_ACCEPT, codec.contentType())
                .header(Protocol.H_AUTHORIZATION, authorization)
                .header(Protocol.H_ACCEPT_LANGUAGE, config.lang())
                .header(Protocol.H_USER_AGENT, USER_AGENT)
                .body(body)
                .connectTimeout(config.connectTimeout())
                .timeout(config.timeout())
                .build();

        if (config.trace()) {
            log.trace("HttpRequest: POST {} {}", path, tagged);
        }

        HttpClientResponse response;
        try {
            response = http.send(httpRequest);
        } catch (HttpClientException e) {
            throw new NakamaException.TransportFault(describe(e), e);
        }

        int status = response.statusCode();
        AuthenticateResponse decoded;
        try {
            decoded = codec.readValue(response.body(), AuthenticateResponse.class);
        } catch (CodecException e) {
            throw new NakamaException.TransportFault("undecodable authentication response (status " + status + ")", e);
        }
        if (config.trace()) {
            log.trace("HttpResponse: {} {}", status, decoded);
        }

        if (decoded.error() != null) {
            log.debug("Authentication rejected: status={} code={}", status, decoded.error().code());
            throw new NakamaException.ProtocolError(decoded.error().code(), decoded.error().message());
        }
        if (status == 200 && decoded.session() != null && decoded.session().token() != null
                && !decoded.session().token().isEmpty()) {
            return new Session(decoded.session().token(), createdAt);
        }
        throw new NakamaException.TransportFault("unexpected authentication response (status " + status + ")");
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static String version() {
        String v = SessionAuthenticator.class.getPackage().getImplementationVersion();
        return v == null ? "dev" : v;
    }
}
