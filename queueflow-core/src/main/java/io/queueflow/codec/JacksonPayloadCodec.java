package io.queueflow.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.queueflow.spi.PayloadCodec;

import java.util.Objects;

/**
 * {@link PayloadCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>The default mapper ignores unknown properties, so payload classes can gain
 * fields while older jobs are still queued, and registers every module found on
 * the classpath (Java time types, for example). A {@code null} payload encodes as
 * {@code "null"}.
 */
public final class JacksonPayloadCodec implements PayloadCodec {
    private static final JacksonPayloadCodec DEFAULT = new JacksonPayloadCodec(createDefaultMapper());

    private final ObjectMapper mapper;

    public JacksonPayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static JacksonPayloadCodec getDefault() {
        return DEFAULT;
    }

    @Override
    public String encode(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to encode payload of type " + payload.getClass().getName(), e);
        }
    }

    @Override
    public <T> T decode(String encoded, Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (type == Void.class || encoded == null) {
            return null;
        }
        try {
            return mapper.readValue(encoded, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode payload as " + type.getName(), e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        m.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        m.findAndRegisterModules();
        return m;
    }
}
