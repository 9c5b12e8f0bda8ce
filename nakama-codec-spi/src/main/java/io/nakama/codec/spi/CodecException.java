package io.nakama.codec.spi;

/**
 * Base exception for envelope serialization and deserialization errors.
 */
public class CodecException extends Exception {
    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public CodecException(Throwable cause) {
        super(cause);
    }
}
