package io.nakama.client;

import io.nakama.core.NakamaException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps collation ids to the requests awaiting their reply.
 *
 * <p>Every operation runs under the table's monitor, so concurrent sends, inbound
 * resolutions, deadline sweeps and the final drain never observe a half-updated table.
 * Once {@link #drain()} has run the table is closed and rejects further inserts.
 */
final class CorrelationTable {

    private final Map<String, PendingRequest> pending = new LinkedHashMap<>();
    private boolean closed;

    /**
     * @throws IllegalStateException if the id is already pending
     * @throws NakamaException.Disconnected if the table has been drained
     */
    synchronized void insert(PendingRequest request) {
        if (closed) {
            throw new NakamaException.Disconnected("connection closed");
        }
        if (pending.containsKey(request.id())) {
            throw new IllegalStateException("collation id already pending: " + request.id());
        }
        pending.put(request.id(), request);
    }

    /**
     * Looks up and removes the request in one step.
     *
     * @throws NakamaException.CorrelationMiss if nothing is pending under the id
     */
    synchronized PendingRequest resolve(String id) {
        PendingRequest request = pending.remove(id);
        if (request == null) {
            throw new NakamaException.CorrelationMiss(id);
        }
        return request;
    }

    /**
     * @return the removed request, or {@code null} if it was already resolved
     */
    synchronized PendingRequest remove(String id) {
        return pending.remove(id);
    }

    synchronized List<PendingRequest> expire(long nowNanos) {
        List<PendingRequest> expired = new ArrayList<>();
        Iterator<PendingRequest> it = pending.values().iterator();
        while (it.hasNext()) {
            PendingRequest request = it.next();
            if (request.isExpired(nowNanos)) {
                it.remove();
                expired.add(request);
            }
        }
        return expired;
    }

    /**
     * Removes every pending request and closes the table.
     *
     * @return the removed requests, in insertion order
     */
    synchronized List<PendingRequest> drain() {
        closed = true;
        List<PendingRequest> all = new ArrayList<>(pending.values());
        pending.clear();
        return all;
    }

    synchronized int size() {
        return pending.size();
    }

    synchronized boolean contains(String id) {
        return pending.containsKey(id);
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
