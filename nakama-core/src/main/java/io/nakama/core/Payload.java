package io.nakama.core;

import java.util.List;
import java.util.Objects;

/**
 * Kind-specific content of an {@link Envelope}.
 *
 * <p>Requests sent by the client ({@link SelfFetch}, {@link SelfUpdate}, {@link UsersFetch},
 * {@link Logout}) and messages produced by the server ({@link Heartbeat}, {@link Error},
 * {@link SelfResult}, {@link UsersResult}) share the same union.
 */
public sealed interface Payload permits Payload.Heartbeat, Payload.Logout, Payload.Error,
        Payload.SelfFetch, Payload.SelfUpdate, Payload.UsersFetch, Payload.SelfResult,
        Payload.UsersResult, Payload.Unknown {

    PayloadKind kind();

    /**
     * Server time announcement.
     *
     * @param timestamp server time in epoch milliseconds
     */
    record Heartbeat(long timestamp) implements Payload {
        @Override
        public PayloadKind kind() {
            return PayloadKind.HEARTBEAT;
        }
    }

    /**
     * Ends the session on the server. Carries no body.
     */
    record Logout() implements Payload {
        @Override
        public PayloadKind kind() {
            return PayloadKind.LOGOUT;
        }
    }

    /**
     * Structured error returned in reply to a request.
     *
     * @param code server error code
     * @param reason human-readable reason
     */
    record Error(int code, String reason) implements Payload {
        @Override
        public PayloadKind kind() {
            return PayloadKind.ERROR;
        }
    }

    record SelfFetch() implements Payload {
        @Override
        public PayloadKind kind() {
            return PayloadKind.SELF_FETCH;
        }
    }

    /**
     * Updates the current user's profile. {@code null} fields are left unchanged.
     */
    record SelfUpdate(String handle, String fullname, String avatarUrl, String lang,
                      String location, String timezone, String metadata) implements Payload {
        @Override
        public PayloadKind kind() {
            return PayloadKind.SELF_UPDATE;
        }
    }

    /**
     * Looks users up by id and/or handle.
     */
    record UsersFetch(List<String> userIds, List<String> handles) implements Payload {
        public UsersFetch {
            userIds = userIds == null ? List.of() : List.copyOf(userIds);
            handles = handles == null ? List.of() : List.copyOf(handles);
        }

        @Override
        public PayloadKind kind() {
            return PayloadKind.USERS_FETCH;
        }
    }

    record SelfResult(Self self) implements Payload {
        public SelfResult {
            Objects.requireNonNull(self, "self");
        }

        @Override
        public PayloadKind kind() {
            return PayloadKind.SELF;
        }
    }

    record UsersResult(List<User> users) implements Payload {
        public UsersResult {
            users = users == null ? List.of() : List.copyOf(users);
        }

        @Override
        public PayloadKind kind() {
            return PayloadKind.USERS;
        }
    }

    /**
     * Placeholder for payload kinds the codec could not map.
     */
    record Unknown() implements Payload {
        @Override
        public PayloadKind kind() {
            return PayloadKind.UNKNOWN;
        }
    }
}
