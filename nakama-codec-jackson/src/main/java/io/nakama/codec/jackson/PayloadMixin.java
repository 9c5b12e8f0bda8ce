package io.nakama.codec.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.nakama.core.Payload;
import io.nakama.core.PayloadKind;

/**
 * Maps the {@link Payload} union to a {@code type} discriminator on the wire.
 * Unrecognised discriminators decode to {@link Payload.Unknown}.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type",
        defaultImpl = Payload.Unknown.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Payload.Heartbeat.class, name = "heartbeat"),
        @JsonSubTypes.Type(value = Payload.Logout.class, name = "logout"),
        @JsonSubTypes.Type(value = Payload.Error.class, name = "error"),
        @JsonSubTypes.Type(value = Payload.SelfFetch.class, name = "self_fetch"),
        @JsonSubTypes.Type(value = Payload.SelfUpdate.class, name = "self_update"),
        @JsonSubTypes.Type(value = Payload.UsersFetch.class, name = "users_fetch"),
        @JsonSubTypes.Type(value = Payload.SelfResult.class, name = "self"),
        @JsonSubTypes.Type(value = Payload.UsersResult.class, name = "users")
})
abstract class PayloadMixin {

    @JsonIgnore
    abstract PayloadKind kind();
}
