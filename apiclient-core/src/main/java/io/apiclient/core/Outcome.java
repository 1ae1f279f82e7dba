package io.apiclient.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Pipeline result before the caller's error mapping is applied.
 *
 * @param <T> the success type
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(ClientError error, byte[] body) {
        return new Failure<>(error, body);
    }

    record Success<T>(T value) implements Outcome<T> {}

    /**
     * @param error the classified failure
     * @param body raw response bytes, or null when none were obtained
     */
    record Failure<T>(ClientError error, byte[] body) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> next) {
        if (this instanceof Success<T> s) {
            return next.apply(s.value());
        }
        Failure<T> f = (Failure<T>) this;
        return new Failure<>(f.error(), f.body());
    }
}
