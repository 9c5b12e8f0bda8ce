package io.nakama.core;

/**
 * Nakama protocol constants (paths, query keys, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP or socket bindings. It only models protocol-level
 * concerns that are shared by the client modules.
 */
public final class Protocol {
    private Protocol() {}

    // Authentication endpoints
    public static final String PATH_LOGIN = "/user/login";
    public static final String PATH_REGISTER = "/user/register";

    // Realtime endpoint
    public static final String PATH_REALTIME = "/api";

    // Realtime query parameter keys
    public static final String Q_SERVER_KEY = "serverkey";
    public static final String Q_TOKEN = "token";
    public static final String Q_LANG = "lang";

    // HTTP headers
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_ACCEPT_LANGUAGE = "Accept-Language";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";
    public static final String H_USER_AGENT = "User-Agent";

    // Content types
    public static final String CT_OCTET_STREAM = "application/octet-stream";

    /** WebSocket close status for a normal, caller-initiated closure. */
    public static final int CLOSE_NORMAL = 1000;

    /** WebSocket close status used when the channel went away without a close handshake. */
    public static final int CLOSE_ABNORMAL = 1006;

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 7350;
    public static final String DEFAULT_LANG = "en";
}
