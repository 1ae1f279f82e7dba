package io.apiclient.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * A {@link BodyDecoder} bound to the target type of an endpoint.
 *
 * <p>When present on a {@link RemoteEndpoint} it takes precedence over the endpoint's parser.
 * Mapping an endpoint maps its override too, so the override survives {@link RemoteEndpoint#map}.
 *
 * @param <T> the decoded type
 */
public final class DecoderOverride<T> {

    private final BodyDecoder decoder;
    private final Parser<T> parser;

    private DecoderOverride(BodyDecoder decoder, Parser<T> parser) {
        this.decoder = decoder;
        this.parser = parser;
    }

    public static <T> DecoderOverride<T> of(BodyDecoder decoder, ValueType<T> type) {
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(type, "type");
        return new DecoderOverride<>(decoder, bytes -> decoder.decode(bytes, type));
    }

    public static <T> DecoderOverride<T> of(BodyDecoder decoder, Class<T> type) {
        return of(decoder, ValueType.of(type));
    }

    public BodyDecoder decoder() {
        return decoder;
    }

    public Decoded<T> decode(byte[] bytes) {
        return parser.parse(bytes);
    }

    <U> DecoderOverride<U> map(Function<? super T, ? extends U> transform) {
        return new DecoderOverride<>(decoder, parser.map(transform));
    }
}
