package io.apiclient.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of decoding a body: a typed value or a {@link DecodeError}.
 *
 * @param <T> the decoded type
 */
public sealed interface Decoded<T> permits Decoded.Success, Decoded.Failure {

    static <T> Decoded<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Decoded<T> failure(DecodeError error) {
        return new Failure<>(error);
    }

    /**
     * A decoded value. {@code value} is null only for body-less results such as {@code Void}.
     */
    record Success<T>(T value) implements Decoded<T> {}

    record Failure<T>(DecodeError error) implements Decoded<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default <U> Decoded<U> map(Function<? super T, ? extends U> transform) {
        Objects.requireNonNull(transform, "transform");
        if (this instanceof Success<T> s) {
            return new Success<>(transform.apply(s.value()));
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super DecodeError, ? extends R> onFailure) {
        if (this instanceof Success<T> s) {
            return onSuccess.apply(s.value());
        }
        return onFailure.apply(((Failure<T>) this).error());
    }
}
