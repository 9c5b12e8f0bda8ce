package io.nakama.core;

/**
 * Body returned by the authentication endpoints. Exactly one of {@code session} and
 * {@code error} is expected to be present.
 */
public record AuthenticateResponse(String collationId, SessionToken session, ErrorDetail error) {

    public record SessionToken(String token) {}

    public record ErrorDetail(int code, String message) {}
}
