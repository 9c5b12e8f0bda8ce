package io.nakama.codec.spi;

import java.io.InputStream;

/**
 * Minimal codec interface for the binary wire format of the Nakama protocol.
 * Implementations wrap a specific serialization library.
 *
 * <p>The codec handles the realtime {@link io.nakama.core.Envelope} union as well as the
 * authentication request and response bodies. Implementations must be thread-safe.
 */
public interface EnvelopeCodec {

    /**
     * Media type of the encoded bytes, sent as {@code Content-Type} and {@code Accept}.
     * @return the content type
     */
    String contentType();

    /**
     * Serializes a protocol message to bytes.
     * @param value the message to serialize
     * @return encoded bytes
     * @throws CodecException if serialization fails
     */
    byte[] writeBytes(Object value) throws CodecException;

    /**
     * Deserializes bytes to a protocol message.
     * @param data encoded bytes
     * @param type target class
     * @return decoded message
     * @throws CodecException if the data is malformed
     */
    <T> T readValue(byte[] data, Class<T> type) throws CodecException;

    /**
     * Deserializes a stream to a protocol message. The stream is not closed.
     * @param input encoded input
     * @param type target class
     * @return decoded message
     * @throws CodecException if the data is malformed
     */
    <T> T readValue(InputStream input, Class<T> type) throws CodecException;
}
