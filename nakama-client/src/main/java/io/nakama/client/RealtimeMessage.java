package io.nakama.client;

import io.nakama.core.NakamaException;
import io.nakama.core.Payload;
import io.nakama.core.ResultSet;
import io.nakama.core.Self;
import io.nakama.core.User;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A request sent over the realtime connection, typed by the value its reply resolves to.
 */
public final class RealtimeMessage<T> {

    private final Payload payload;
    private final Class<?> resultType;

    private RealtimeMessage(Payload payload, Class<?> resultType) {
        this.payload = Objects.requireNonNull(payload, "payload");
        this.resultType = resultType;
    }

    public static RealtimeMessage<Self> selfFetch() {
        return new RealtimeMessage<>(new Payload.SelfFetch(), Self.class);
    }

    /**
     * Updates the current user's profile; the reply is an empty acknowledgement.
     */
    public static RealtimeMessage<Boolean> selfUpdate(Payload.SelfUpdate update) {
        return new RealtimeMessage<>(update, Boolean.class);
    }

    public static RealtimeMessage<ResultSet<User>> usersFetchById(String... userIds) {
        return new RealtimeMessage<>(new Payload.UsersFetch(List.of(userIds), null), ResultSet.class);
    }

    public static RealtimeMessage<ResultSet<User>> usersFetchByHandle(String... handles) {
        return new RealtimeMessage<>(new Payload.UsersFetch(null, Arrays.asList(handles)), ResultSet.class);
    }

    public Payload payload() {
        return payload;
    }

    @SuppressWarnings("unchecked")
    T cast(Object value) {
        if (!resultType.isInstance(value)) {
            throw new NakamaException.ProtocolError(0, "unexpected reply to " + payload.kind()
                    + ": expected " + resultType.getSimpleName() + " but got "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        return (T) value;
    }

    @Override
    public String toString() {
        return "RealtimeMessage[" + payload + "]";
    }
}
