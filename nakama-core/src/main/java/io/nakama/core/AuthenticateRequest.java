package io.nakama.core;

import java.util.Objects;

/**
 * Body of a login or register exchange.
 *
 * @param collationId per-call tag used to correlate server logs
 * @param credentials what the user authenticates with
 */
public record AuthenticateRequest(String collationId, AuthenticateRequest.Credentials credentials) {

    public AuthenticateRequest {
        Objects.requireNonNull(credentials, "credentials");
    }

    public AuthenticateRequest withCollationId(String collationId) {
        return new AuthenticateRequest(collationId, credentials);
    }

    public static AuthenticateRequest email(String email, String password) {
        return new AuthenticateRequest(null, new Email(email, password));
    }

    public static AuthenticateRequest device(String id) {
        return new AuthenticateRequest(null, new Device(id));
    }

    public static AuthenticateRequest custom(String id) {
        return new AuthenticateRequest(null, new Custom(id));
    }

    public sealed interface Credentials permits Email, Device, Custom {}

    public record Email(String email, String password) implements Credentials {
        public Email {
            Objects.requireNonNull(email, "email");
            Objects.requireNonNull(password, "password");
        }

        @Override
        public String toString() {
            return "Email[email=" + email + "]";
        }
    }

    public record Device(String id) implements Credentials {
        public Device {
            Objects.requireNonNull(id, "id");
        }
    }

    public record Custom(String id) implements Credentials {
        public Custom {
            Objects.requireNonNull(id, "id");
        }
    }
}
