package io.nakama.core;

import java.util.Objects;

/**
 * Token-bearing credential obtained from authentication and used to open the realtime channel.
 *
 * @param token opaque session token issued by the server
 * @param createdAt local time of the authentication request, in epoch milliseconds
 */
public record Session(String token, long createdAt) {
    public Session {
        Objects.requireNonNull(token, "token");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("token must not be empty");
        }
    }

    @Override
    public String toString() {
        return "Session[createdAt=" + createdAt + "]";
    }
}
