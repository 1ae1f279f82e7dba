package io.apiclient.client;

import io.apiclient.core.CancelableOperation;
import io.apiclient.core.MalformedRequestException;
import io.apiclient.core.RemoteEndpoint;
import io.apiclient.http.spi.HttpClientAdapter;
import io.apiclient.http.spi.HttpClientRequest;
import io.apiclient.http.spi.HttpClientResponse;
import io.apiclient.http.spi.JdkHttpClientAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Executes {@link RemoteEndpoint}s against a base URL.
 *
 * <p>Every call style runs the same steps: merge the default headers into the endpoint
 * (the endpoint's own values win), consult the stub behavior, build the request, send it,
 * validate the response, decode the body and map any failure through the
 * {@link ErrorMapper} exactly once.
 *
 * <p>The default headers and stub behavior may be changed at any time. Each call reads both
 * once when it starts; later changes never affect a call already in flight.
 *
 * <pre>{@code
 * ApiClient<ApiClientException> client = ApiClient.builder("https://api.example.com").build();
 * User user = client.fetch(RemoteEndpoint.get("/users/42", json.parser(User.class)));
 * }</pre>
 *
 * @param <E> the caller's error type
 */
public final class ApiClient<E extends Exception> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiClient.class);

    private final ApiClientConfig<E> config;
    private final ErrorNormalizer<E> normalizer;
    private final AtomicReference<Map<String, String>> headers;
    private final AtomicReference<StubBehavior<E>> stubBehavior;

    private ApiClient(ApiClientConfig<E> config) {
        this.config = config;
        this.normalizer = new ErrorNormalizer<>(config.errorMapper());
        this.headers = new AtomicReference<>(config.headers());
        this.stubBehavior = new AtomicReference<>(config.stubBehavior());
    }

    /**
     * Starts a builder whose error type is {@link ApiClientException}; call
     * {@link Builder#errorMapper(ErrorMapper)} to choose another.
     */
    public static Builder<ApiClientException> builder(String baseUrl) {
        return new Builder<>(baseUrl, ErrorMapper.identity());
    }

    public ApiClientConfig<E> config() {
        return config;
    }

    public String baseUrl() {
        return config.baseUrl();
    }

    // ===== Mutable state =====

    public Map<String, String> headers() {
        return headers.get();
    }

    /**
     * Replaces the default headers for calls started from now on.
     */
    public void setHeaders(Map<String, String> headers) {
        this.headers.set(Map.copyOf(Objects.requireNonNull(headers, "headers")));
    }

    public Optional<StubBehavior<E>> stubBehavior() {
        return Optional.ofNullable(stubBehavior.get());
    }

    /**
     * Installs a stub behavior, replacing any previous one, for calls started from now on.
     */
    public void setStubBehavior(StubBehavior<E> behavior) {
        stubBehavior.set(Objects.requireNonNull(behavior, "behavior"));
    }

    public void clearStubBehavior() {
        stubBehavior.set(null);
    }

    CallSnapshot<E> snapshot() {
        return new CallSnapshot<>(headers.get(), stubBehavior.get());
    }

    // ===== Request construction =====

    /**
     * Returns the request a call to {@code endpoint} would send right now.
     *
     * @throws MalformedRequestException if the URL cannot be formed
     */
    public HttpClientRequest request(RemoteEndpoint<?> endpoint) {
        return RequestFactory.create(config.baseUrl(), endpoint.append(headers.get()), config.timeout());
    }

    // ===== Call styles =====

    /**
     * Starts a call and delivers its result to {@code callback} on a pool thread, never inside
     * this method. Stubbed calls deliver before this method returns.
     *
     * @throws MalformedRequestException if the URL cannot be formed
     */
    public <T> CancelableOperation load(RemoteEndpoint<T> endpoint, ApiCallback<? super T, ? super E> callback) {
        Objects.requireNonNull(callback, "callback");
        return load(endpoint, result -> {
            if (result instanceof Result.Success<T, E> s) {
                callback.onSuccess(s.value());
            } else {
                callback.onFailure(((Result.Failure<T, E>) result).error());
            }
        });
    }

    public <T> CancelableOperation load(RemoteEndpoint<T> endpoint, Consumer<? super Result<T, E>> completion) {
        Objects.requireNonNull(completion, "completion");
        Call<T, E> call = start(endpoint);
        if (call.stubbed() != null) {
            deliver(completion, call.stubbed());
            return CancelableOperation.noop();
        }

        CallbackOperation operation = new CallbackOperation(call.future());
        // never on the caller's thread, even when the transport completed synchronously
        call.future().whenCompleteAsync((result, error) -> {
            if (error != null) {
                if (!(error instanceof CancellationException)) {
                    LOGGER.warn("Call to {} failed unexpectedly", endpoint.path(), error);
                }
                return;
            }
            if (operation.claimDelivery()) {
                deliver(completion, result);
            } else {
                LOGGER.debug("Delivery for {} suppressed by cancel", endpoint.path());
            }
        });
        return operation;
    }

    /**
     * Runs a call and waits for it. Interrupting the waiting thread cancels the exchange.
     *
     * @throws E the mapped failure
     * @throws MalformedRequestException if the URL cannot be formed
     */
    public <T> T fetch(RemoteEndpoint<T> endpoint) throws E, InterruptedException {
        Call<T, E> call = start(endpoint);
        if (call.stubbed() != null) {
            return call.stubbed().getOrThrow();
        }

        Result<T, E> result;
        try {
            result = call.future().get();
        } catch (InterruptedException e) {
            call.future().cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw propagate(ResponsePipeline.unwrap(e));
        }
        return result.getOrThrow();
    }

    /**
     * Returns a publisher that runs the call once per subscription and emits the value
     * (nothing for a null value) then completes, or signals the mapped error.
     */
    public <T> Flow.Publisher<T> publisher(RemoteEndpoint<T> endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        return subscriber -> {
            Objects.requireNonNull(subscriber, "subscriber");
            SubmissionPublisher<T> pub = new SubmissionPublisher<>();
            pub.subscribe(subscriber);

            Call<T, E> call;
            try {
                call = start(endpoint);
            } catch (MalformedRequestException e) {
                pub.closeExceptionally(e);
                return;
            }
            if (call.stubbed() != null) {
                emit(pub, call.stubbed());
                return;
            }
            call.future().whenComplete((result, error) -> {
                if (error != null) {
                    pub.closeExceptionally(ResponsePipeline.unwrap(error));
                } else {
                    emit(pub, result);
                }
            });
        };
    }

    /**
     * Runs a call and completes the future with its result. Cancelling the future cancels
     * the exchange.
     *
     * @throws MalformedRequestException if the URL cannot be formed
     */
    public <T> CompletableFuture<Result<T, E>> execute(RemoteEndpoint<T> endpoint) {
        Call<T, E> call = start(endpoint);
        return call.stubbed() != null ? CompletableFuture.completedFuture(call.stubbed()) : call.future();
    }

    // ===== Pipeline =====

    private record Call<T, E extends Exception>(Result<T, E> stubbed, CompletableFuture<Result<T, E>> future) {}

    private <T> Call<T, E> start(RemoteEndpoint<T> endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        CallSnapshot<E> snapshot = snapshot();
        RemoteEndpoint<T> merged = endpoint.append(snapshot.headers());

        Optional<Result<T, E>> stubbed = StubEngine.resolve(snapshot.stub(), merged, normalizer);
        if (stubbed.isPresent()) {
            LOGGER.debug("Stubbed {} {}", merged.method().name(), merged.path());
            return new Call<>(stubbed.get(), null);
        }

        HttpClientRequest request = RequestFactory.create(config.baseUrl(), merged, config.timeout());
        CompletableFuture<HttpClientResponse> exchange = config.httpClient().execute(request);
        CompletableFuture<Result<T, E>> future = exchange.handle((response, error) -> {
            if (error != null) {
                LOGGER.debug("Transport failure for {}", request, error);
                return normalizer.normalize(ResponsePipeline.<T>transportFailure(error));
            }
            return normalizer.normalize(ResponsePipeline.process(merged, response.statusCode(), response.body()));
        });
        future.whenComplete((result, error) -> {
            if (error instanceof CancellationException) {
                exchange.cancel(true);
            }
        });
        return new Call<>(null, future);
    }

    private static <T, E extends Exception> void deliver(Consumer<? super Result<T, E>> completion, Result<T, E> result) {
        try {
            completion.accept(result);
        } catch (RuntimeException e) {
            LOGGER.warn("Completion callback threw", e);
        }
    }

    private static <T, E extends Exception> void emit(SubmissionPublisher<T> pub, Result<T, E> result) {
        if (result instanceof Result.Success<T, E> s) {
            if (s.value() != null) {
                pub.submit(s.value());
            }
            pub.close();
        } else {
            pub.closeExceptionally(((Result.Failure<T, E>) result).error());
        }
    }

    private static RuntimeException propagate(Throwable t) {
        if (t instanceof RuntimeException re) return re;
        if (t instanceof Error err) throw err;
        return new IllegalStateException(t);
    }

    public static final class Builder<E extends Exception> {
        private final String baseUrl;
        private final ErrorMapper<E> errorMapper;
        private Map<String, String> headers = Map.of("Content-Type", "application/json");
        private HttpClientAdapter httpClient;
        private Duration timeout;
        private StubBehavior<E> stubBehavior;

        private Builder(String baseUrl, ErrorMapper<E> errorMapper) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            this.errorMapper = errorMapper;
        }

        /**
         * Switches the client's error type. Resets any stub behavior set so far, since it
         * was typed for the previous error type.
         */
        public <F extends Exception> Builder<F> errorMapper(ErrorMapper<F> errorMapper) {
            Builder<F> next = new Builder<>(baseUrl, Objects.requireNonNull(errorMapper, "errorMapper"));
            next.headers = headers;
            next.httpClient = httpClient;
            next.timeout = timeout;
            return next;
        }

        /**
         * Replaces the default headers. Defaults to {@code Content-Type: application/json}.
         */
        public Builder<E> headers(Map<String, String> headers) {
            this.headers = new LinkedHashMap<>(Objects.requireNonNull(headers, "headers"));
            return this;
        }

        public Builder<E> header(String name, String value) {
            Map<String, String> copy = new LinkedHashMap<>(headers);
            copy.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            this.headers = copy;
            return this;
        }

        public Builder<E> httpClient(HttpClientAdapter httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            return this;
        }

        public Builder<E> timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder<E> stubBehavior(StubBehavior<E> stubBehavior) {
            this.stubBehavior = stubBehavior;
            return this;
        }

        public ApiClient<E> build() {
            HttpClientAdapter resolved = httpClient;
            if (resolved == null) {
                resolved = JdkHttpClientAdapter.create();
            }
            return new ApiClient<>(new ApiClientConfig<>(baseUrl, headers, errorMapper, resolved, timeout, stubBehavior));
        }
    }
}
