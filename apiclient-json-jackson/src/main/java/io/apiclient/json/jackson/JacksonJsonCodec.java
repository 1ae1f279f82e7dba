package io.apiclient.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidNullException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.apiclient.core.DecodeError;
import io.apiclient.core.ValueType;
import io.apiclient.json.spi.JsonCodec;
import io.apiclient.json.spi.JsonException;

import java.util.List;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Provides JSON serialization/deserialization using Jackson.
 *
 * <p>Deserialization failures are classified into {@link DecodeError.Kind}s with the JSON path
 * at which decoding stopped, e.g. {@code /members/0/id}.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper: unknown properties are ignored,
     * missing creator properties and nulls for primitives are errors.
     */
    public JacksonJsonCodec() {
        this(JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw translate(e, type.getTypeName());
        }
    }

    @Override
    public <T> T readValue(byte[] data, ValueType<T> type) throws JsonException {
        JavaType javaType = mapper.getTypeFactory().constructType(type.type());
        try {
            return mapper.readValue(data, javaType);
        } catch (Exception e) {
            throw translate(e, type.typeName());
        }
    }

    private static JsonException translate(Exception e, String rootType) {
        String message = "Failed to deserialize bytes to " + rootType;
        if (!(e instanceof JsonProcessingException)) {
            return new JsonException(DecodeError.Kind.DATA_CORRUPTED, "", rootType, message, e);
        }
        if (!(e instanceof JsonMappingException)) {
            // parser-level failure: the bytes are not JSON
            return new JsonException(DecodeError.Kind.DATA_CORRUPTED, "", rootType,
                    message + ": " + ((JsonProcessingException) e).getOriginalMessage(), e);
        }

        JsonMappingException jme = (JsonMappingException) e;
        String path = path(jme.getPath());
        String detail = String.valueOf(jme.getOriginalMessage());
        String expected = rootType;
        if (e instanceof MismatchedInputException && ((MismatchedInputException) e).getTargetType() != null) {
            expected = ((MismatchedInputException) e).getTargetType().getTypeName();
        }

        DecodeError.Kind kind;
        if (e instanceof InvalidNullException || detail.startsWith("Cannot map `null`")) {
            kind = DecodeError.Kind.VALUE_NOT_FOUND;
        } else if (detail.startsWith(MISSING_CREATOR_PROPERTY)) {
            kind = DecodeError.Kind.KEY_NOT_FOUND;
            path = path + "/" + missingPropertyName(detail);
        } else if (detail.startsWith("No content to map")) {
            kind = DecodeError.Kind.DATA_CORRUPTED;
        } else if (e instanceof MismatchedInputException) {
            kind = DecodeError.Kind.TYPE_MISMATCH;
        } else {
            kind = DecodeError.Kind.DATA_CORRUPTED;
        }
        return new JsonException(kind, path, expected, message + ": " + detail, e);
    }

    // Jackson has no dedicated exception type for these; its messages are stable across 2.x.
    private static final String MISSING_CREATOR_PROPERTY = "Missing required creator property '";

    private static String missingPropertyName(String detail) {
        int start = MISSING_CREATOR_PROPERTY.length();
        int end = detail.indexOf('\'', start);
        return end < 0 ? "" : detail.substring(start, end);
    }

    private static String path(List<JsonMappingException.Reference> references) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : references) {
            sb.append('/');
            if (ref.getFieldName() != null) {
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append(ref.getIndex());
            }
        }
        return sb.toString();
    }
}
