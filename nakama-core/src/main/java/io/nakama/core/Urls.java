package io.nakama.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Builds server endpoint URLs. Query keys are written in sorted order so a given set of
 * parameters always produces the same URL.
 */
public final class Urls {
    private Urls() {}

    public static URI endpoint(String scheme, String host, int port, String path) {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        String suffix = path == null ? "" : path;
        return URI.create(scheme + "://" + host + ":" + port + suffix);
    }

    /**
     * Appends form-encoded parameters, skipping entries with a {@code null} key or value.
     */
    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) {
            return base;
        }
        StringJoiner query = new StringJoiner("&");
        new TreeMap<>(params).forEach((key, value) -> {
            if (key != null && value != null) {
                query.add(encode(key) + "=" + encode(value));
            }
        });
        String separator = base.getRawQuery() == null ? "?" : "&";
        return URI.create(base + separator + query);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
