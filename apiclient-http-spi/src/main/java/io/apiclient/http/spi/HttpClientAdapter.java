package io.apiclient.http.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the API client to work with different HTTP client libraries
 * (JDK HttpClient, Apache HttpClient, OkHttp, etc.) without direct dependency on any
 * specific implementation.
 *
 * <p>Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com")).build();
 * HttpClientResponse response = adapter.execute(request).join();
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request asynchronously, reading the whole response body into memory.
     *
     * <p>The returned future completes exactly once: with the response for any status code,
     * or exceptionally with an {@link HttpClientException} ({@link HttpTimeoutException} for
     * timeouts) when no response was obtained. Cancelling the future aborts the exchange
     * where the underlying client supports it.
     *
     * @param request the HTTP request to send
     * @return a future of the HTTP response with body as bytes
     */
    CompletableFuture<HttpClientResponse> execute(HttpClientRequest request);
}
