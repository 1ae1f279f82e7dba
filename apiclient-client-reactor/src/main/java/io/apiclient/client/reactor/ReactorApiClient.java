package io.apiclient.client.reactor;

import io.apiclient.client.ApiClient;
import io.apiclient.core.RemoteEndpoint;
import io.apiclient.reactive.FlowInterop;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Reactor adapter over {@link ApiClient}.
 *
 * <p>Each subscription to a returned {@link Mono} runs the call anew. Endpoints producing
 * null values, such as {@code Void}, complete empty. Failures arrive as the client's mapped
 * error type.
 */
public final class ReactorApiClient<E extends Exception> {

    private final ApiClient<E> delegate;

    public ReactorApiClient(ApiClient<E> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public ApiClient<E> delegate() {
        return delegate;
    }

    public <T> Mono<T> mono(RemoteEndpoint<T> endpoint) {
        return Mono.from(FlowInterop.toReactiveStreams(delegate.publisher(endpoint)));
    }
}
