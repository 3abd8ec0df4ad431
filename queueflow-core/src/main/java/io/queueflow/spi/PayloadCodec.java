package io.queueflow.spi;

import io.queueflow.codec.JacksonPayloadCodec;

/**
 * Encodes task payloads to the string form stored by the broker and back.
 *
 * @see JacksonPayloadCodec
 */
public interface PayloadCodec {

    /**
     * Returns the default Jackson-based codec.
     */
    static PayloadCodec getDefault() {
        return JacksonPayloadCodec.getDefault();
    }

    /**
     * @param payload the payload, may be {@code null}
     * @return the encoded payload, never {@code null}
     * @throws IllegalArgumentException if the payload cannot be encoded
     */
    String encode(Object payload);

    /**
     * @param encoded the encoded payload
     * @param type    the target type; {@link Void} always decodes to {@code null}
     * @return the decoded payload
     * @throws IllegalArgumentException if the payload cannot be decoded into {@code type}
     */
    <T> T decode(String encoded, Class<T> type);
}
