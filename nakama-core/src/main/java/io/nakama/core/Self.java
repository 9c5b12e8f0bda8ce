package io.nakama.core;

import java.util.List;
import java.util.Objects;

/**
 * Profile of the user that owns the current session, including private fields.
 */
public record Self(User user, boolean verified, String email, List<String> deviceIds) {
    public Self {
        Objects.requireNonNull(user, "user");
        deviceIds = deviceIds == null ? List.of() : List.copyOf(deviceIds);
    }
}
