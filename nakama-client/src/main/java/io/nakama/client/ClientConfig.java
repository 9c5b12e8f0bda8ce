package io.nakama.client;

import io.nakama.core.Protocol;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable client configuration.
 *
 * @param serverKey server credential key, sent as Basic authorization and as a socket query parameter
 * @param host server host
 * @param port server port
 * @param ssl use {@code https}/{@code wss}
 * @param lang language tag sent with every exchange
 * @param connectTimeout bound on HTTP and socket connection establishment
 * @param timeout bound on HTTP reads and writes, and on the socket close handshake
 * @param requestTimeout deadline for a socket request to receive its reply, or {@code null} for none
 * @param trace log protocol traffic at TRACE level
 */
public record ClientConfig(
        String serverKey,
        String host,
        int port,
        boolean ssl,
        String lang,
        Duration connectTimeout,
        Duration timeout,
        Duration requestTimeout,
        boolean trace
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMillis(3000);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000);

    static final String PREFIX = "nakama.";

    public ClientConfig {
        Objects.requireNonNull(serverKey, "serverKey");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(lang, "lang");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(timeout, "timeout");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(timeout, "timeout");
        if (requestTimeout != null) {
            requirePositive(requestTimeout, "requestTimeout");
        }
    }

    public static Builder builder(String serverKey) {
        return new Builder(serverKey);
    }

    /**
     * Reads {@code nakama.*} keys over the defaults. Recognised keys are {@code server-key}
     * (required), {@code host}, {@code port}, {@code ssl}, {@code lang},
     * {@code connect-timeout-ms}, {@code timeout-ms}, {@code request-timeout-ms} and {@code trace}.
     *
     * @throws IllegalArgumentException if the server key is missing or a value does not parse
     */
    public static ClientConfig fromProperties(Properties props) {
        String serverKey = props.getProperty(PREFIX + "server-key");
        if (serverKey == null || serverKey.isBlank()) {
            throw new IllegalArgumentException("missing required property: " + PREFIX + "server-key");
        }
        Builder b = builder(serverKey.trim());
        String v;
        if ((v = prop(props, "host")) != null) b.host(v);
        if ((v = prop(props, "port")) != null) b.port(parseInt("port", v));
        if ((v = prop(props, "ssl")) != null) b.ssl(Boolean.parseBoolean(v));
        if ((v = prop(props, "lang")) != null) b.lang(v);
        if ((v = prop(props, "connect-timeout-ms")) != null) b.connectTimeout(Duration.ofMillis(parseInt("connect-timeout-ms", v)));
        if ((v = prop(props, "timeout-ms")) != null) b.timeout(Duration.ofMillis(parseInt("timeout-ms", v)));
        if ((v = prop(props, "request-timeout-ms")) != null) b.requestTimeout(Duration.ofMillis(parseInt("request-timeout-ms", v)));
        if ((v = prop(props, "trace")) != null) b.trace(Boolean.parseBoolean(v));
        return b.build();
    }

    public String httpScheme() {
        return ssl ? "https" : "http";
    }

    public String socketScheme() {
        return ssl ? "wss" : "ws";
    }

    public Builder toBuilder() {
        return new Builder(serverKey)
                .host(host)
                .port(port)
                .ssl(ssl)
                .lang(lang)
                .connectTimeout(connectTimeout)
                .timeout(timeout)
                .requestTimeout(requestTimeout)
                .trace(trace);
    }

    @Override
    public String toString() {
        return "ClientConfig[host=" + host + ", port=" + port + ", ssl=" + ssl + ", lang=" + lang
                + ", connectTimeout=" + connectTimeout + ", timeout=" + timeout
                + ", requestTimeout=" + requestTimeout + ", trace=" + trace + ", serverKey=****]";
    }

    private static String prop(Properties props, String key) {
        String v = props.getProperty(PREFIX + key);
        if (v == null || v.isBlank()) return null;
        return v.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }

    /**
     * Fluent builder. Every {@link #build()} returns a new record; later changes to the
     * builder do not reach configs that were already built.
     */
    public static final class Builder {
        private final String serverKey;
        private String host = Protocol.DEFAULT_HOST;
        private int port = Protocol.DEFAULT_PORT;
        private boolean ssl;
        private String lang = Protocol.DEFAULT_LANG;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration requestTimeout;
        private boolean trace;

        private Builder(String serverKey) {
            this.serverKey = Objects.requireNonNull(serverKey, "serverKey");
        }

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder lang(String lang) {
            this.lang = Objects.requireNonNull(lang, "lang");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder trace(boolean trace) {
            this.trace = trace;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(serverKey, host, port, ssl, lang, connectTimeout, timeout, requestTimeout, trace);
        }
    }
}
