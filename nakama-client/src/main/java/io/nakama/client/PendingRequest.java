package io.nakama.client;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * An outstanding socket request awaiting exactly one reply.
 *
 * <p>Owned by the {@link CorrelationTable}; only the party that removed it from the table
 * may complete it.
 */
final class PendingRequest {

    /** Deadline value for requests that never expire. */
    static final long NO_DEADLINE = Long.MAX_VALUE;

    private final String id;
    private final CompletableFuture<Object> result = new CompletableFuture<>();
    private final long deadlineNanos;

    PendingRequest(String id, long deadlineNanos) {
        this.id = Objects.requireNonNull(id, "id");
        this.deadlineNanos = deadlineNanos;
    }

    String id() {
        return id;
    }

    CompletableFuture<Object> result() {
        return result;
    }

    boolean isExpired(long nowNanos) {
        return deadlineNanos != NO_DEADLINE && nowNanos - deadlineNanos >= 0;
    }

    void succeed(Object value) {
        result.complete(value);
    }

    void fail(Throwable error) {
        result.completeExceptionally(error);
    }
}
