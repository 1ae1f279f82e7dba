package io.apiclient.json.spi;

import io.apiclient.core.BodyDecoder;
import io.apiclient.core.Decoded;
import io.apiclient.core.Parser;
import io.apiclient.core.ValueType;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>A codec is also a {@link BodyDecoder}, so it can serve as an endpoint's decoder
 * override, and it produces {@link Parser}s for endpoint declarations:
 * <pre>{@code
 * JsonCodec json = JsonCodecs.load();
 * RemoteEndpoint<User> user = RemoteEndpoint.get("/users/42", json.parser(User.class));
 * }</pre>
 */
public interface JsonCodec extends BodyDecoder {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array, e.g. for a POST body.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON bytes to a possibly generic type.
     * @param data JSON bytes
     * @param type target type
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, ValueType<T> type) throws JsonException;

    @Override
    default <T> Decoded<T> decode(byte[] bytes, ValueType<T> type) {
        try {
            return Decoded.success(readValue(bytes, type));
        } catch (JsonException e) {
            return Decoded.failure(e.toDecodeError());
        }
    }

    default <T> Parser<T> parser(Class<T> type) {
        return parser(ValueType.of(type));
    }

    default <T> Parser<T> parser(ValueType<T> type) {
        return bytes -> decode(bytes, type);
    }
}
