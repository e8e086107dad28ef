package com.example.redismanager.codec;

import com.example.redismanager.error.ErrorKind;
import com.example.redismanager.error.ManagerException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.math.BigInteger;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Type-preserving conversion between Java values and the strings stored in Redis.
 * <p>
 * {@link BigInteger} and {@code byte[]} values are wrapped in tag markers; every other
 * value, strings included, is written as JSON text. Tagged forms are never quoted, so a
 * string that happens to contain a tag still decodes as a string.
 * <p>
 * Reads fall back to the raw text when it is not valid JSON, which keeps values written
 * as bare strings readable.
 */
public class ValueCodec {

    static final String BIGINT_TAG = "<JSON_HANDLER_BIGINT_TAG>";
    static final String BUFFER_TAG = "<JSON_HANDLER_BUFFER_TAG>";

    private static final HexFormat HEX = HexFormat.of();

    private final ObjectMapper objectMapper;

    public ValueCodec() {
        this(JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build());
    }

    public ValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(Object value) {
        if (value instanceof Optional) {
            // empty Optional stands in for an undefined value
            value = ((Optional<?>) value).orElse(null);
        }
        if (value instanceof byte[]) {
            return BUFFER_TAG + HEX.formatHex((byte[]) value) + BUFFER_TAG;
        }
        if (value instanceof BigInteger) {
            return BIGINT_TAG + value + BIGINT_TAG;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ManagerException(ErrorKind.UNKNOWN_INTERNAL,
                    "Value of type " + value.getClass().getName() + " cannot be serialized.", e);
        }
    }

    public Object parse(String wire) {
        if (wire == null) {
            throw new ManagerException(ErrorKind.UNKNOWN_INTERNAL, "Value from Redis should be a string, got null.");
        }
        if (isTagged(wire, BUFFER_TAG)) {
            String hex = untag(wire, BUFFER_TAG);
            try {
                return HEX.parseHex(hex);
            } catch (IllegalArgumentException e) {
                throw new ManagerException(ErrorKind.UNKNOWN_INTERNAL, "Malformed buffer value: " + hex, e);
            }
        }
        if (isTagged(wire, BIGINT_TAG)) {
            String digits = untag(wire, BIGINT_TAG);
            try {
                return new BigInteger(digits);
            } catch (NumberFormatException e) {
                throw new ManagerException(ErrorKind.UNKNOWN_INTERNAL, "Malformed bigint value: " + digits, e);
            }
        }
        try {
            return objectMapper.readValue(wire, Object.class);
        } catch (JsonProcessingException e) {
            return wire;
        }
    }

    /**
     * Decodes {@code wire} and converts the result to {@code type}, e.g. a stored JSON
     * object into a POJO.
     */
    public <T> T parse(String wire, Class<T> type) {
        Object decoded = parse(wire);
        if (decoded == null || type.isInstance(decoded)) {
            return type.cast(decoded);
        }
        try {
            return objectMapper.convertValue(decoded, type);
        } catch (IllegalArgumentException e) {
            throw new ManagerException(ErrorKind.UNKNOWN_INTERNAL,
                    "Stored value cannot be read as " + type.getName() + ".", e);
        }
    }

    private static boolean isTagged(String wire, String tag) {
        return wire.length() >= 2 * tag.length() && wire.startsWith(tag) && wire.endsWith(tag);
    }

    private static String untag(String wire, String tag) {
        return wire.substring(tag.length(), wire.length() - tag.length());
    }
}
