package io.nakama.client;

import io.nakama.core.Protocol;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientConfigTest {

    @Test
    void defaults() {
        ClientConfig config = ClientConfig.builder("defaultkey").build();

        assertThat(config.host()).isEqualTo(Protocol.DEFAULT_HOST);
        assertThat(config.port()).isEqualTo(7350);
        assertThat(config.ssl()).isFalse();
        assertThat(config.lang()).isEqualTo("en");
        assertThat(config.connectTimeout()).isEqualTo(Duration.ofMillis(3000));
        assertThat(config.timeout()).isEqualTo(Duration.ofMillis(5000));
        assertThat(config.requestTimeout()).isNull();
        assertThat(config.trace()).isFalse();
        assertThat(config.httpScheme()).isEqualTo("http");
        assertThat(config.socketScheme()).isEqualTo("ws");
    }

    @Test
    void builtConfigIsUnaffectedByLaterBuilderChanges() {
        ClientConfig.Builder builder = ClientConfig.builder("defaultkey").host("a.example");
        ClientConfig first = builder.build();

        builder.host("b.example").ssl(true);

        assertThat(first.host()).isEqualTo("a.example");
        assertThat(first.ssl()).isFalse();
        assertThat(builder.build().socketScheme()).isEqualTo("wss");
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> ClientConfig.builder("k").port(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.builder("k").timeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.builder("k").requestTimeout(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsProperties() {
        Properties props = new Properties();
        props.setProperty("nakama.server-key", " secret ");
        props.setProperty("nakama.host", "game.example");
        props.setProperty("nakama.port", "443");
        props.setProperty("nakama.ssl", "true");
        props.setProperty("nakama.request-timeout-ms", "2500");
        props.setProperty("nakama.trace", "true");

        ClientConfig config = ClientConfig.fromProperties(props);

        assertThat(config.serverKey()).isEqualTo("secret");
        assertThat(config.host()).isEqualTo("game.example");
        assertThat(config.port()).isEqualTo(443);
        assertThat(config.ssl()).isTrue();
        assertThat(config.requestTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.trace()).isTrue();
        assertThat(config.lang()).isEqualTo("en");
    }

    @Test
    void propertiesRequireServerKeyAndNumericValues() {
        assertThatThrownBy(() -> ClientConfig.fromProperties(new Properties()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nakama.server-key");

        Properties props = new Properties();
        props.setProperty("nakama.server-key", "k");
        props.setProperty("nakama.port", "http");
        assertThatThrownBy(() -> ClientConfig.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nakama.port");
    }

    @Test
    void toStringMasksServerKey() {
        assertThat(ClientConfig.builder("topsecret").build().toString())
                .doesNotContain("topsecret")
                .contains("serverKey=****");
    }
}
