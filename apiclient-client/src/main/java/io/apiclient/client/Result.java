package io.apiclient.client;

import java.util.Objects;
import java.util.function.Function;

/**
 * Terminal outcome of a call, in the caller's error type.
 *
 * @param <T> the value type
 * @param <E> the caller's error type
 */
public sealed interface Result<T, E extends Exception> permits Result.Success, Result.Failure {

    static <T, E extends Exception> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E extends Exception> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    /**
     * @param value the decoded value, null for body-less results such as {@code Void}
     */
    record Success<T, E extends Exception>(T value) implements Result<T, E> {}

    record Failure<T, E extends Exception>(E error) implements Result<T, E> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        if (this instanceof Success<T, E> s) {
            return onSuccess.apply(s.value());
        }
        return onFailure.apply(((Failure<T, E>) this).error());
    }

    /**
     * Returns the value or throws the error.
     */
    default T getOrThrow() throws E {
        if (this instanceof Success<T, E> s) {
            return s.value();
        }
        throw ((Failure<T, E>) this).error();
    }
}
