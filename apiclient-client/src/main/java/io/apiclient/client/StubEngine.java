package io.apiclient.client;

import io.apiclient.core.AnyEndpoint;
import io.apiclient.core.ClientError;
import io.apiclient.core.Outcome;
import io.apiclient.core.RemoteEndpoint;

import java.util.Objects;
import java.util.Optional;

/**
 * Answers calls from the installed {@link StubBehavior} without touching the transport.
 */
final class StubEngine {
    private StubEngine() {}

    /**
     * Returns the stubbed result, or empty when no behavior is installed.
     */
    static <T, E extends Exception> Optional<Result<T, E>> resolve(
            Optional<StubBehavior<E>> behavior, RemoteEndpoint<T> endpoint, ErrorNormalizer<E> normalizer) {
        if (behavior.isEmpty()) return Optional.empty();

        StubBehavior<E> stub = behavior.get();
        if (stub instanceof StubBehavior.ImmediateError<E> immediateError) {
            E error = immediateError.error().apply(endpoint.erase());
            return Optional.of(Result.failure(Objects.requireNonNull(error, "stub error")));
        }
        if (stub instanceof StubBehavior.ImmediateOverride<E> override) {
            AnyEndpoint erased = endpoint.erase();
            byte[] body = Objects.requireNonNull(override.body().apply(erased), "stub body");
            return Optional.of(normalizer.normalize(ResponsePipeline.decode(endpoint, body)));
        }

        Outcome<T> outcome = endpoint.sampleData()
                .map(sample -> ResponsePipeline.decode(endpoint, sample))
                .orElseGet(() -> Outcome.failure(new ClientError.MissingSampleData(endpoint.path()), null));
        return Optional.of(normalizer.normalize(outcome));
    }
}
