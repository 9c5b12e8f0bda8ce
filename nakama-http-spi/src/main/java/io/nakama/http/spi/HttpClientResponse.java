package io.nakama.http.spi;

import java.util.Optional;

/**
 * Status, headers and fully read body of an HTTP exchange.
 */
public interface HttpClientResponse {

    int statusCode();

    /**
     * @param name header name, matched ignoring case
     * @return the first value, or empty if the header is absent
     */
    Optional<String> header(String name);

    /**
     * @return the body bytes, empty but never {@code null}
     */
    byte[] body();

    default boolean isSuccess() {
        int status = statusCode();
        return status >= 200 && status < 300;
    }
}
