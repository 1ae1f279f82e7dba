package io.apiclient.http.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 * This is the default implementation when no other HTTP client library is available.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClientAdapter.class);

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    @Override
    public CompletableFuture<HttpClientResponse> execute(HttpClientRequest request) {
        HttpRequest jdkRequest;
        try {
            jdkRequest = toJdkRequest(request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new HttpClientException(request, "cannot be sent: " + e.getMessage(), e));
        }

        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        CompletableFuture<HttpResponse<byte[]>> exchange = httpClient.sendAsync(jdkRequest, HttpResponse.BodyHandlers.ofByteArray());
        exchange.whenComplete((response, error) -> {
            if (error != null) {
                HttpClientException translated = translate(request, error);
                LOGGER.debug("{} failed: {}", request, translated.toString());
                result.completeExceptionally(translated);
            } else {
                result.complete(new ByteArrayResponse(response.statusCode(), response.headers().map(), response.body()));
            }
        });
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());

        HttpRequest.BodyPublisher bodyPublisher = request.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                : HttpRequest.BodyPublishers.noBody();

        builder.method(request.method(), bodyPublisher);
        request.headers().forEach(builder::setHeader);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        return builder.build();
    }

    private static HttpClientException translate(HttpClientRequest request, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof java.net.http.HttpTimeoutException) {
            return new HttpTimeoutException(request, cause);
        }
        if (cause instanceof HttpClientException) {
            return (HttpClientException) cause;
        }
        return new HttpClientException(request, HttpClientException.describe(cause), cause);
    }
}
