package io.apiclient.client.rxjava3;

import io.apiclient.client.ApiClient;
import io.apiclient.core.RemoteEndpoint;
import io.apiclient.reactive.FlowInterop;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;

import java.util.Objects;

/**
 * RxJava3 adapter over {@link ApiClient}.
 */
public final class RxJavaApiClient<E extends Exception> {

    private final ApiClient<E> delegate;

    public RxJavaApiClient(ApiClient<E> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public ApiClient<E> delegate() {
        return delegate;
    }

    /**
     * Emits the decoded value. Signals {@link java.util.NoSuchElementException} for endpoints
     * producing null values; use {@link #completable} or {@link #maybe} for those.
     */
    public <T> Single<T> single(RemoteEndpoint<T> endpoint) {
        return Single.fromPublisher(FlowInterop.toReactiveStreams(delegate.publisher(endpoint)));
    }

    public <T> Maybe<T> maybe(RemoteEndpoint<T> endpoint) {
        return Maybe.fromPublisher(FlowInterop.toReactiveStreams(delegate.publisher(endpoint)));
    }

    /**
     * Runs the call for its side effect, ignoring the decoded value.
     */
    public Completable completable(RemoteEndpoint<?> endpoint) {
        return Completable.fromPublisher(FlowInterop.toReactiveStreams(delegate.publisher(endpoint)));
    }
}
