package io.apiclient.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Function;

/**
 * Turns response bytes into a typed value.
 *
 * <p>Implementations must be pure: parsing identical bytes twice yields equal results. Stubs
 * replay sample data through the same parser.
 *
 * @param <T> the decoded type
 */
@FunctionalInterface
public interface Parser<T> {

    Decoded<T> parse(byte[] bytes);

    default <U> Parser<U> map(Function<? super T, ? extends U> transform) {
        Objects.requireNonNull(transform, "transform");
        return bytes -> parse(bytes).map(transform);
    }

    /**
     * Returns the raw bytes unchanged.
     */
    static Parser<byte[]> bytes() {
        return Decoded::success;
    }

    static Parser<String> utf8() {
        return bytes -> Decoded.success(new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Ignores the body, for endpoints answering 204 or whose body is irrelevant.
     */
    static Parser<Void> discarding() {
        return bytes -> Decoded.success(null);
    }
}
