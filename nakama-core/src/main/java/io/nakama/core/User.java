package io.nakama.core;

/**
 * Public profile of a user.
 *
 * @param createdAt epoch milliseconds
 * @param updatedAt epoch milliseconds
 * @param lastOnlineAt epoch milliseconds
 */
public record User(
        String id,
        String handle,
        String fullname,
        String avatarUrl,
        String lang,
        String location,
        String timezone,
        String metadata,
        long createdAt,
        long updatedAt,
        long lastOnlineAt
) {}
