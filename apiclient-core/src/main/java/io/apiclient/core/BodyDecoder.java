package io.apiclient.core;

/**
 * Format decoder (JSON or other) that endpoints may use instead of their own parser.
 *
 * <p>Decoding is synchronous and must not perform I/O.
 */
public interface BodyDecoder {

    <T> Decoded<T> decode(byte[] bytes, ValueType<T> type);
}
