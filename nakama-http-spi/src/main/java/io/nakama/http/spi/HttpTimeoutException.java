package io.nakama.http.spi;

/**
 * The exchange ran past one of its two timeouts.
 */
public class HttpTimeoutException extends HttpClientException {

    /** Which timeout elapsed. */
    public enum Phase {
        /** Connection establishment, bounded by {@link HttpClientRequest#connectTimeout()}. */
        CONNECT,
        /** Writing the request or reading the response, bounded by {@link HttpClientRequest#timeout()}. */
        REQUEST
    }

    private final Phase phase;

    public HttpTimeoutException(Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public Phase phase() {
        return phase;
    }
}
