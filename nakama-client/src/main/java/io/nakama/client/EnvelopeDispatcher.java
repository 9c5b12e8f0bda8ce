package io.nakama.client;

import io.nakama.core.Envelope;
import io.nakama.core.NakamaException;
import io.nakama.core.Payload;
import io.nakama.core.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Routes each decoded inbound envelope to the clock, a pending request, or the push sink.
 *
 * <p>Must be called from a single thread at a time, in frame order.
 */
final class EnvelopeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeDispatcher.class);

    private final CorrelationTable table;
    private final ServerClock clock;
    private final Consumer<Envelope> pushSink;
    private final boolean trace;

    EnvelopeDispatcher(CorrelationTable table, ServerClock clock, Consumer<Envelope> pushSink, boolean trace) {
        this.table = Objects.requireNonNull(table, "table");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pushSink = Objects.requireNonNull(pushSink, "pushSink");
        this.trace = trace;
    }

    void dispatch(Envelope envelope) {
        switch (envelope.kind()) {
            case HEARTBEAT -> {
                long timestamp = ((Payload.Heartbeat) envelope.payload()).timestamp();
                if (!clock.observe(timestamp) && trace) {
                    log.trace("Ignoring stale heartbeat {}", timestamp);
                }
                return;
            }
            case NONE, ERROR, SELF, USERS -> {
                // replies, handled below
            }
            default -> {
                if (trace) {
                    log.trace("Unrecognized message: {}", envelope);
                }
                return;
            }
        }

        if (!envelope.hasCollationId()) {
            pushSink.accept(envelope);
            return;
        }

        PendingRequest request;
        try {
            request = table.resolve(envelope.collationId());
        } catch (NakamaException.CorrelationMiss e) {
            log.warn("Dropping {} reply: {}", envelope.kind(), e.getMessage());
            return;
        }

        switch (envelope.kind()) {
            case NONE -> request.succeed(Boolean.TRUE);
            case ERROR -> {
                Payload.Error error = (Payload.Error) envelope.payload();
                request.fail(new NakamaException.ProtocolError(error.code(), error.reason()));
            }
            case SELF -> request.succeed(((Payload.SelfResult) envelope.payload()).self());
            case USERS -> request.succeed(new ResultSet<>(((Payload.UsersResult) envelope.payload()).users(), null));
            default -> throw new IllegalStateException("unreachable: " + envelope.kind());
        }
    }
}
