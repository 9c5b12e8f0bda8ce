package io.nakama.core;

/**
 * Discriminant of the {@link Envelope} tagged union.
 */
public enum PayloadKind {
    /** Empty acknowledgement; the envelope carries no payload. */
    NONE,
    ERROR,
    /** Server-pushed frame carrying the current server time. */
    HEARTBEAT,
    LOGOUT,
    SELF_FETCH,
    SELF_UPDATE,
    USERS_FETCH,
    SELF,
    USERS,
    /** A kind this client does not recognise. */
    UNKNOWN
}
