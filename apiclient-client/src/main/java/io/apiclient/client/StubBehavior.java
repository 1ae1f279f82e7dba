package io.apiclient.client;

import io.apiclient.core.AnyEndpoint;

import java.util.Objects;
import java.util.function.Function;

/**
 * Replaces the network for every call while installed on an {@link ApiClient}.
 *
 * <p>The functions receive the endpoint with the client's default headers merged in and its
 * value type erased, so one behavior can serve endpoints of any result type.
 *
 * @param <E> the caller's error type
 */
public sealed interface StubBehavior<E extends Exception>
        permits StubBehavior.Immediate, StubBehavior.ImmediateError, StubBehavior.ImmediateOverride {

    /**
     * Answers with the endpoint's sample data.
     */
    static <E extends Exception> StubBehavior<E> immediate() {
        return new Immediate<>();
    }

    /**
     * Fails every call with the supplied error, bypassing the error mapper.
     */
    static <E extends Exception> StubBehavior<E> error(Function<AnyEndpoint, ? extends E> error) {
        return new ImmediateError<>(error);
    }

    /**
     * Answers with the supplied bytes, decoded as a successful response body.
     */
    static <E extends Exception> StubBehavior<E> override(Function<AnyEndpoint, byte[]> body) {
        return new ImmediateOverride<>(body);
    }

    record Immediate<E extends Exception>() implements StubBehavior<E> {}

    record ImmediateError<E extends Exception>(Function<AnyEndpoint, ? extends E> error) implements StubBehavior<E> {
        public ImmediateError {
            Objects.requireNonNull(error, "error");
        }
    }

    record ImmediateOverride<E extends Exception>(Function<AnyEndpoint, byte[]> body) implements StubBehavior<E> {
        public ImmediateOverride {
            Objects.requireNonNull(body, "body");
        }
    }
}
