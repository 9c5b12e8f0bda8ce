package io.nakama.http.spi;

import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link HttpClientAdapter} over the JDK {@link HttpClient}; the default when nothing else is
 * configured.
 *
 * <p>The connect timeout belongs to the {@link HttpClient} itself and is fixed when it is built,
 * so a per-request {@link HttpClientRequest#connectTimeout()} is not applied. Build the client with
 * {@link #create(Duration)} instead. The request timeout is applied per request.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    /**
     * @param connectTimeout bound on connection establishment for every exchange
     */
    public static JdkHttpClientAdapter create(Duration connectTimeout) {
        return new JdkHttpClientAdapter(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build());
    }

    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(toJdkRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpConnectTimeoutException e) {
            throw new HttpTimeoutException(HttpTimeoutException.Phase.CONNECT, "Connect timed out: " + request.uri(), e);
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(HttpTimeoutException.Phase.REQUEST, "Request timed out: " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Interrupted during " + request.method() + " " + request.uri(), e);
        } catch (Exception e) {
            throw new HttpClientException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
        return new BufferedResponse(response.statusCode(), response.headers().map(), response.body());
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.BodyPublisher publisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .method(request.method(), publisher);
        request.headers().forEach(builder::header);
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        return builder.build();
    }
}
