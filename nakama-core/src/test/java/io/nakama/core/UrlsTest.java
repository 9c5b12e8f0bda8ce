package io.nakama.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UrlsTest {

    @Test
    void endpointJoinsSchemeHostPortAndPath() {
        URI uri = Urls.endpoint("https", "example.com", 7350, Protocol.PATH_LOGIN);
        assertThat(uri.toString()).isEqualTo("https://example.com:7350/user/login");
    }

    @Test
    void withQuerySortsKeysAndEncodesValues() {
        URI base = Urls.endpoint("ws", "127.0.0.1", 7350, Protocol.PATH_REALTIME);
        URI uri = Urls.withQuery(base, Map.of(
                Protocol.Q_TOKEN, "a b+c",
                Protocol.Q_SERVER_KEY, "defaultkey",
                Protocol.Q_LANG, "en"));

        assertThat(uri.toString())
                .isEqualTo("ws://127.0.0.1:7350/api?lang=en&serverkey=defaultkey&token=a+b%2Bc");
    }

    @Test
    void withQueryAppendsToExistingQuery() {
        URI uri = Urls.withQuery(URI.create("http://localhost/x?a=1"), Map.of("b", "2"));
        assertThat(uri.getQuery()).isEqualTo("a=1&b=2");
    }

    @Test
    void withQueryReturnsBaseForEmptyParams() {
        URI base = URI.create("http://localhost/x");
        assertThat(Urls.withQuery(base, Map.of())).isSameAs(base);
    }
}
