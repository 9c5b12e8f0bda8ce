package io.nakama.http.spi;

/**
 * Abstraction for the unary HTTP exchange used by session authentication.
 *
 * <p>This interface lets the Nakama client work with different HTTP client libraries
 * (JDK HttpClient, OkHttp) without a direct dependency on either.
 *
 * <p>Implementations must be thread-safe and reusable. A response with an error status is
 * returned normally; only transport failures are thrown.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create(Duration.ofSeconds(3));
 * HttpClientRequest request = HttpClientRequest.post(URI.create("http://127.0.0.1:7350/user/login"))
 *         .body(bytes)
 *         .build();
 * HttpClientResponse response = adapter.send(request);
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and reads the whole response body into memory.
     *
     * @param request the HTTP request to send
     * @return the HTTP response, whatever its status
     * @throws HttpClientException if the request could not be written or the response not read
     * @throws HttpTimeoutException if the connect or request timeout elapsed
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
