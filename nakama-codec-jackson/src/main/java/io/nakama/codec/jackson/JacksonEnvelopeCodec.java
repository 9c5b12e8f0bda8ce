package io.nakama.codec.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import io.nakama.codec.spi.CodecException;
import io.nakama.codec.spi.EnvelopeCodec;
import io.nakama.core.AuthenticateRequest;
import io.nakama.core.Envelope;
import io.nakama.core.Payload;
import io.nakama.core.Protocol;

import java.io.InputStream;
import java.util.Objects;

/**
 * Jackson implementation of {@link EnvelopeCodec}.
 *
 * <p>The default instance writes CBOR, a compact binary encoding of the JSON data model.
 * {@link #json()} produces plain JSON, which is handy when inspecting traffic.
 */
public final class JacksonEnvelopeCodec implements EnvelopeCodec {
    private final ObjectMapper mapper;
    private final String contentType;

    /**
     * Creates a CBOR codec. Used by {@link java.util.ServiceLoader}.
     */
    public JacksonEnvelopeCodec() {
        this(new ObjectMapper(new CBORFactory()), Protocol.CT_OCTET_STREAM);
    }

    /**
     * Creates a codec over a custom ObjectMapper. The mapper is copied before the protocol
     * mix-ins are registered, so the caller's instance is left untouched.
     *
     * @param mapper the ObjectMapper to derive from
     * @param contentType media type of the mapper's format
     */
    public JacksonEnvelopeCodec(ObjectMapper mapper, String contentType) {
        this.mapper = configure(Objects.requireNonNull(mapper, "mapper").copy());
        this.contentType = Objects.requireNonNull(contentType, "contentType");
    }

    public static JacksonEnvelopeCodec json() {
        return new JacksonEnvelopeCodec(new ObjectMapper(new JsonFactory()), "application/json");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String contentType() {
        return contentType;
    }

    @Override
    public byte[] writeBytes(Object value) throws CodecException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new CodecException("Failed to serialize " + typeName(value), e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws CodecException {
        if (data == null || data.length == 0) {
            throw new CodecException("Cannot decode " + type.getName() + " from empty data");
        }
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new CodecException("Failed to deserialize bytes to " + type.getName(), e);
        }
    }

    @Override
    public <T> T readValue(InputStream input, Class<T> type) throws CodecException {
        try {
            return mapper.readValue(input, type);
        } catch (Exception e) {
            throw new CodecException("Failed to deserialize input stream to " + type.getName(), e);
        }
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .addMixIn(Envelope.class, EnvelopeMixin.class)
                .addMixIn(Payload.class, PayloadMixin.class)
                .addMixIn(AuthenticateRequest.Credentials.class, CredentialsMixin.class)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
