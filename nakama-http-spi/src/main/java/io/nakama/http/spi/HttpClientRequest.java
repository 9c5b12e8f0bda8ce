package io.nakama.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request handed to an {@link HttpClientAdapter}.
 *
 * @param connectTimeout bound on connection establishment, or {@code null} for the adapter default
 * @param timeout bound on writing the request and reading the response, or {@code null} for the adapter default
 */
public record HttpClientRequest(
        URI uri,
        String method,
        Map<String, String> headers,
        byte[] body,
        Duration connectTimeout,
        Duration timeout
) {
    public HttpClientRequest {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(method, "method");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static Builder post(URI uri) {
        return new Builder(uri, "POST");
    }

    @Override
    public String toString() {
        return "HttpClientRequest[" + method + " " + uri + ", body=" + (body == null ? 0 : body.length) + " bytes]";
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration connectTimeout;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(uri, method, headers, body, connectTimeout, timeout);
        }
    }
}
