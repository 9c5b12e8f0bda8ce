package io.nakama.core;

/**
 * Outer wire structure wrapping every message exchanged over the realtime channel.
 *
 * <p>A reply echoes the collation id of the request it answers. Server pushes such as
 * heartbeats carry no collation id. An envelope without a payload is an empty acknowledgement.
 *
 * @param collationId correlation identifier, or {@code null}
 * @param payload kind-specific content, or {@code null} for {@link PayloadKind#NONE}
 */
public record Envelope(String collationId, Payload payload) {

    public static Envelope of(Payload payload) {
        return new Envelope(null, payload);
    }

    public PayloadKind kind() {
        return payload == null ? PayloadKind.NONE : payload.kind();
    }

    public boolean hasCollationId() {
        return collationId != null && !collationId.isEmpty();
    }
}
