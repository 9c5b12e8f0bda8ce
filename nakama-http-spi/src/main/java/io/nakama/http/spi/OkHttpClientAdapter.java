package io.nakama.http.spi;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath. Unlike the JDK adapter,
 * both the connect timeout and the read/write timeout are applied per request.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        OkHttpClient client = clientWithTimeouts(request);
        Request okRequest = toOkHttpRequest(request);
        try (Response response = client.newCall(okRequest).execute()) {
            ResponseBody body = response.body();
            return new BufferedResponse(response.code(), response.headers().toMultimap(),
                    body != null ? body.bytes() : null);
        } catch (SocketTimeoutException e) {
            HttpTimeoutException.Phase phase = isConnectTimeout(e)
                    ? HttpTimeoutException.Phase.CONNECT
                    : HttpTimeoutException.Phase.REQUEST;
            throw new HttpTimeoutException(phase, phase == HttpTimeoutException.Phase.CONNECT
                    ? "Connect timed out: " + request.uri()
                    : "Request timed out: " + request.uri(), e);
        } catch (InterruptedIOException e) {
            // OkHttp reports an elapsed call timeout this way
            throw new HttpTimeoutException(HttpTimeoutException.Phase.REQUEST, "Request timed out: " + request.uri(), e);
        } catch (IOException e) {
            throw new HttpClientException(e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }
    }

    private static boolean isConnectTimeout(SocketTimeoutException e) {
        String message = e.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).startsWith("connect");
    }

    private OkHttpClient clientWithTimeouts(HttpClientRequest request) {
        Duration connect = request.connectTimeout();
        Duration io = request.timeout();
        if (connect == null && io == null) {
            return httpClient;
        }
        // newBuilder() shares the connection pool and dispatcher with the base client
        OkHttpClient.Builder tuned = httpClient.newBuilder();
        if (connect != null) {
            tuned.connectTimeout(connect);
        }
        if (io != null) {
            tuned.readTimeout(io).writeTimeout(io);
        }
        return tuned.build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder().url(request.uri().toString());
        request.headers().forEach(builder::header);

        RequestBody body = null;
        byte[] bytes = request.body();
        if (bytes != null || requiresBody(request.method())) {
            String contentType = request.headers().get("Content-Type");
            body = RequestBody.create(bytes != null ? bytes : new byte[0],
                    contentType != null ? MediaType.parse(contentType) : null);
        }
        return builder.method(request.method(), body).build();
    }

    private static boolean requiresBody(String method) {
        return method.equals("POST") || method.equals("PUT") || method.equals("PATCH");
    }
}
