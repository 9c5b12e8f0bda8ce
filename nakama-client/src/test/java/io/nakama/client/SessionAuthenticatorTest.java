package io.nakama.client;

import io.nakama.codec.jackson.JacksonEnvelopeCodec;
import io.nakama.core.AuthenticateRequest;
import io.nakama.core.NakamaException;
import io.nakama.core.Protocol;
import io.nakama.core.Session;
import io.nakama.http.spi.HttpClientAdapter;
import io.nakama.http.spi.JdkHttpClientAdapter;
import io.nakama.http.spi.OkHttpClientAdapter;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionAuthenticatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    private final JacksonEnvelopeCodec codec = JacksonEnvelopeCodec.json();
    private MockWebServer server;
    private ExecutorService executor;
    private ClientConfig config;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newSingleThreadExecutor();
        config = ClientConfig.builder("defaultkey")
                .host(server.getHostName())
                .port(server.getPort())
                .lang("de")
                .timeout(Duration.ofMillis(500))
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        server.shutdown();
    }

    @Test
    void loginReturnsSessionAndSendsProtocolHeaders() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"session\":{\"token\":\"abc123\"}}"));

        Session session = authenticator(JdkHttpClientAdapter.create())
                .authenticate(Protocol.PATH_LOGIN, AuthenticateRequest.email("a@b.c", "pw"))
                .get(2, TimeUnit.SECONDS);

        assertThat(session.token()).isEqualTo("abc123");
        assertThat(session.createdAt()).isEqualTo(CLOCK.millis());

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/user/login");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Basic "
                + Base64.getEncoder().encodeToString("defaultkey:".getBytes(StandardCharsets.UTF_8)));
        assertThat(recorded.getHeader("Accept-Language")).isEqualTo("de");
        assertThat(recorded.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
        assertThat(recorded.getHeader("User-Agent")).startsWith("nakama-java/");

        String body = recorded.getBody().readUtf8();
        assertThat(body).contains("\"collationId\"").contains("\"type\":\"email\"").contains("a@b.c");
    }

    @Test
    void registerUsesRegisterEndpoint() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"session\":{\"token\":\"t2\"}}"));

        Session session = authenticator(OkHttpClientAdapter.create())
                .authenticate(Protocol.PATH_REGISTER, AuthenticateRequest.device("device-1"))
                .get(2, TimeUnit.SECONDS);

        assertThat(session.token()).isEqualTo("t2");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/user/register");
    }

    @Test
    void errorBodyBecomesProtocolError() {
        server.enqueue(new MockResponse()
                .setResponseCode(401)
                .setBody("{\"error\":{\"code\":401,\"message\":\"invalid credentials\"}}"));

        var future = authenticator(JdkHttpClientAdapter.create())
                .authenticate(Protocol.PATH_LOGIN, AuthenticateRequest.email("a@b.c", "wrong"));

        assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(NakamaException.ProtocolError.class)
                .satisfies(e -> {
                    NakamaException.ProtocolError error = (NakamaException.ProtocolError) e.getCause();
                    assertThat(error.code()).isEqualTo(401);
                    assertThat(error.reason()).isEqualTo("invalid credentials");
                });
    }

    @Test
    void undecodableBodyIsTransportFaultNamingStatus() {
        server.enqueue(new MockResponse().setResponseCode(502).setBody("<html>bad gateway</html>"));

        var future = authenticator(JdkHttpClientAdapter.create())
                .authenticate(Protocol.PATH_LOGIN, AuthenticateRequest.custom("c-1"));

        assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(NakamaException.TransportFault.class)
                .hasMessageContaining("502");
    }

    @Test
    void unreachableServerIsTransportFault() throws Exception {
        server.shutdown();

        var future = authenticator(JdkHttpClientAdapter.create())
                .authenticate(Protocol.PATH_LOGIN, AuthenticateRequest.custom("c-1"));

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(NakamaException.TransportFault.class);
    }

    @Test
    void slowServerIsTransportFault() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"session\":{\"token\":\"late\"}}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        var future = authenticator(OkHttpClientAdapter.create())
                .authenticate(Protocol.PATH_LOGIN, AuthenticateRequest.custom("c-1"));

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(NakamaException.TransportFault.class);
    }

    @Test
    void rejectedExecutionCompletesExceptionally() {
        SessionAuthenticator authenticator = new SessionAuthenticator(config, JdkHttpClientAdapter.create(), codec,
                task -> { throw new RejectedExecutionException("shut down"); }, CLOCK);

        var future = authenticator.authenticate(Protocol.PATH_LOGIN, AuthenticateRequest.custom("c-1"));

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(NakamaException.TransportFault.class);
        assertThat(server.getRequestCount()).isZero();
    }

    private SessionAuthenticator authenticator(HttpClientAdapter http) {
        return new SessionAuthenticator(config, http, codec, executor, CLOCK);
    }
}
