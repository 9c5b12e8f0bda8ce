package io.nakama.http.spi;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fully read response shared by the bundled adapters. Header names are matched ignoring case.
 */
record BufferedResponse(int statusCode, Map<String, List<String>> headers, byte[] body) implements HttpClientResponse {

    private static final byte[] EMPTY = new byte[0];

    BufferedResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    copy.put(name, List.copyOf(values));
                }
            });
        }
        headers = copy;
        body = body == null ? EMPTY : body;
    }

    @Override
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }
}
