package io.nakama.http.spi;

/**
 * The HTTP exchange could not be completed: the request was not written or the response
 * was not read. A response with an error status is not an exception.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
