package io.nakama.core;

/**
 * Base class for errors surfaced to callers of the Nakama client.
 *
 * <p>These are delivered through the futures and callbacks returned by the client, never
 * thrown across an asynchronous boundary.
 */
public abstract class NakamaException extends RuntimeException {

    protected NakamaException(String message) {
        super(message);
    }

    protected NakamaException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Connect, write or read failure at the socket or HTTP layer.
     */
    public static class TransportFault extends NakamaException {
        public TransportFault(String message) {
            super(message);
        }

        public TransportFault(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The server answered with a structured error.
     */
    public static class ProtocolError extends NakamaException {
        private final int code;

        public ProtocolError(int code, String reason) {
            super(reason);
            this.code = code;
        }

        public int code() {
            return code;
        }

        public String reason() {
            return getMessage();
        }
    }

    /**
     * An inbound reply carries a collation id with no matching pending request.
     */
    public static class CorrelationMiss extends NakamaException {
        private final String collationId;

        public CorrelationMiss(String collationId) {
            super("no pending request for collation id " + collationId);
            this.collationId = collationId;
        }

        public String collationId() {
            return collationId;
        }
    }

    /**
     * The channel closed while the request was pending.
     */
    public static class Disconnected extends NakamaException {
        public Disconnected(String message) {
            super(message);
        }
    }

    /**
     * No reply arrived before the request deadline.
     */
    public static class RequestTimeout extends NakamaException {
        public RequestTimeout(String message) {
            super(message);
        }
    }

    /**
     * The operation is not valid in the connection's current state.
     */
    public static class InvalidState extends NakamaException {
        public InvalidState(String message) {
            super(message);
        }
    }
}
