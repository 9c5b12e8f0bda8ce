package io.nakama.client;

import io.nakama.codec.jackson.JacksonEnvelopeCodec;
import io.nakama.core.AuthenticateRequest;
import io.nakama.core.Envelope;
import io.nakama.core.NakamaException;
import io.nakama.core.Payload;
import io.nakama.core.Session;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NakamaClientTest {

    private final JacksonEnvelopeCodec codec = JacksonEnvelopeCodec.json();
    private final FakeChannel.Factory channels = new FakeChannel.Factory();
    private MockWebServer server;
    private NakamaClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = NakamaClient.builder("defaultkey")
                .host(server.getHostName())
                .port(server.getPort())
                .connectTimeout(Duration.ofMillis(300))
                .codec(codec)
                .channelFactory(channels)
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    @Test
    void builderSnapshotsConfiguration() {
        NakamaClientBuilder builder = NakamaClient.builder("defaultkey").host("a.example").codec(codec).channelFactory(channels);
        NakamaClient first = builder.build();
        builder.host("b.example");
        NakamaClient second = builder.build();

        assertThat(first.config().host()).isEqualTo("a.example");
        assertThat(second.config().host()).isEqualTo("b.example");
        first.close();
        second.close();
    }

    @Test
    void loginCallbackDeliversSession() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"session\":{\"token\":\"abc123\"}}"));
        AtomicReference<Session> session = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        client.login(AuthenticateRequest.email("a@b.c", "pw"),
                s -> { session.set(s); done.countDown(); },
                e -> done.countDown());

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(session.get().token()).isEqualTo("abc123");
    }

    @Test
    void registerCallbackDeliversFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":{\"code\":3,\"message\":\"handle in use\"}}"));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        client.register(AuthenticateRequest.custom("c-1"),
                s -> done.countDown(),
                e -> { failure.set(e); done.countDown(); });

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(failure.get()).isInstanceOf(NakamaException.ProtocolError.class).hasMessage("handle in use");
    }

    @Test
    void connectSendAndDisconnect() throws Exception {
        AtomicInteger disconnects = new AtomicInteger();
        client.addListener(new ClientListener() {
            @Override
            public void onDisconnect() {
                disconnects.incrementAndGet();
            }
        });

        client.connect(new Session("abc123", 0L));
        assertThat(client.isConnected()).isTrue();
        FakeChannel channel = channels.last();
        assertThat(channel.uri.getQuery()).contains("token=abc123").contains("serverkey=defaultkey");

        CompletableFuture<Boolean> update = client.send(RealtimeMessage.selfUpdate(
                new Payload.SelfUpdate(null, "Alice", null, null, null, null, null)));
        Envelope request = codec.readValue(channel.frame(0), Envelope.class);
        channel.receive(codec.writeBytes(new Envelope(request.collationId(), null)));
        assertThat(update.get(1, TimeUnit.SECONDS)).isTrue();

        channel.receive(codec.writeBytes(Envelope.of(new Payload.Heartbeat(4_000_000_000_000L))));
        client.disconnect();

        assertThat(client.isConnected()).isFalse();
        assertThat(disconnects).hasValue(1);
        assertThat(client.serverTime()).isEqualTo(4_000_000_000_000L);
    }

    @Test
    void connectReusesOpenConnectionAndReconnectBuildsNewOne() throws Exception {
        Session session = new Session("abc123", 0L);
        client.connectAsync(session).get(1, TimeUnit.SECONDS);
        client.connectAsync(session).get(1, TimeUnit.SECONDS);
        assertThat(channels.created).hasSize(1);

        channels.last().peerClosed(1001, "restart");
        assertThat(client.isConnected()).isFalse();

        client.connect(session);
        assertThat(channels.created).hasSize(2);
        assertThat(client.isConnected()).isTrue();
    }

    @Test
    void listenerReceivesServerPushes() throws Exception {
        AtomicReference<Envelope> pushed = new AtomicReference<>();
        ClientListener listener = new ClientListener() {
            @Override
            public void onMessage(Envelope envelope) {
                pushed.set(envelope);
            }
        };
        client.addListener(listener);
        client.connect(new Session("abc123", 0L));

        Envelope push = Envelope.of(new Payload.Error(9, "kicked"));
        channels.last().receive(codec.writeBytes(push));
        assertThat(pushed.get()).isEqualTo(push);

        client.removeListener(listener);
        pushed.set(null);
        channels.last().receive(codec.writeBytes(push));
        assertThat(pushed.get()).isNull();
    }

    @Test
    void connectTimesOutWhenChannelNeverOpens() {
        channels.openOnConnect = false;

        assertThatThrownBy(() -> client.connect(new Session("abc123", 0L)))
                .isInstanceOf(NakamaException.TransportFault.class)
                .hasMessageContaining("300ms");
        assertThat(channels.last().events).contains("abort");
        assertThat(client.isConnected()).isFalse();
    }

    @Test
    void connectCallbackReportsOpen() throws Exception {
        CountDownLatch opened = new CountDownLatch(1);

        client.connect(new Session("abc123", 0L), opened::countDown, e -> { });

        assertThat(opened.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void sendWithoutConnectionIsInvalidState() throws Exception {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        client.send(RealtimeMessage.selfFetch(), self -> done.countDown(), e -> { failure.set(e); done.countDown(); });

        assertThat(done.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(failure.get()).isInstanceOf(NakamaException.InvalidState.class);
        assertThat(client.disconnectAsync()).isCompleted();
    }

    @Test
    void disconnectCallbackRunsAfterClose() throws Exception {
        client.connect(new Session("abc123", 0L));
        CountDownLatch closed = new CountDownLatch(1);

        client.disconnect(closed::countDown);

        assertThat(closed.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(channels.last().events).contains("close:1000");
    }
}
