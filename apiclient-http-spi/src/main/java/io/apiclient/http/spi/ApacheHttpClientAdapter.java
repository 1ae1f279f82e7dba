package io.apiclient.http.spi;

import org.apache.hc.client5.http.async.methods.SimpleHttpRequest;
import org.apache.hc.client5.http.async.methods.SimpleHttpResponse;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.async.CloseableHttpAsyncClient;
import org.apache.hc.client5.http.impl.async.HttpAsyncClients;
import org.apache.hc.core5.concurrent.FutureCallback;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * {@link HttpClientAdapter} implementation using the Apache HttpClient 5 async client.
 *
 * <p>Requires {@code org.apache.httpcomponents.client5:httpclient5} on the classpath. The
 * adapter starts the client if needed; close it to release the client's I/O reactor.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApacheHttpClientAdapter.class);

    private final CloseableHttpAsyncClient httpClient;

    public ApacheHttpClientAdapter(CloseableHttpAsyncClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.httpClient.start();
    }

    public static ApacheHttpClientAdapter create() {
        return new ApacheHttpClientAdapter(HttpAsyncClients.createDefault());
    }

    public static ApacheHttpClientAdapter create(CloseableHttpAsyncClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient);
    }

    @Override
    public CompletableFuture<HttpClientResponse> execute(HttpClientRequest request) {
        SimpleHttpRequest apacheRequest = toApacheRequest(request);

        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        Future<SimpleHttpResponse> exchange = httpClient.execute(apacheRequest, new FutureCallback<>() {
            @Override
            public void completed(SimpleHttpResponse response) {
                result.complete(new ByteArrayResponse(response.getCode(), headers(response.getHeaders()), response.getBodyBytes()));
            }

            @Override
            public void failed(Exception e) {
                HttpClientException translated = translate(request, e);
                LOGGER.debug("{} failed: {}", request, translated.toString());
                result.completeExceptionally(translated);
            }

            @Override
            public void cancelled() {
                result.cancel(false);
            }
        });
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    @Override
    public void close() {
        httpClient.close(CloseMode.IMMEDIATE);
    }

    private static SimpleHttpRequest toApacheRequest(HttpClientRequest request) {
        SimpleHttpRequest apacheRequest = new SimpleHttpRequest(request.method(), request.uri());

        request.headers().forEach(apacheRequest::setHeader);

        if (request.hasBody()) {
            String contentType = request.headers().get("Content-Type");
            ContentType type = contentType != null ? ContentType.parse(contentType) : ContentType.APPLICATION_OCTET_STREAM;
            apacheRequest.setBody(request.body(), type);
        }

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.ofMilliseconds(millis))
                    .setConnectionRequestTimeout(Timeout.ofMilliseconds(millis))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }

    private static Map<String, List<String>> headers(Header[] headers) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Header h : headers) {
            out.computeIfAbsent(h.getName(), k -> new ArrayList<>()).add(h.getValue());
        }
        return out;
    }

    private static HttpClientException translate(HttpClientRequest request, Exception e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof SocketTimeoutException) return new HttpTimeoutException(request, e);
            cause = cause.getCause();
        }
        return new HttpClientException(request, HttpClientException.describe(e), e);
    }
}
