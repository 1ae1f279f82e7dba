package io.apiclient.http.spi;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(OkHttpClientAdapter.class);

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public CompletableFuture<HttpClientResponse> execute(HttpClientRequest request) {
        Request okRequest;
        try {
            okRequest = toOkHttpRequest(request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new HttpClientException(request, "cannot be sent: " + e.getMessage(), e));
        }

        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        Call call = clientWithTimeout(request).newCall(okRequest);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                HttpClientException translated = translate(request, e);
                LOGGER.debug("{} failed: {}", request, translated.toString());
                result.completeExceptionally(translated);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    ResponseBody responseBody = response.body();
                    byte[] body = responseBody != null ? responseBody.bytes() : null;
                    result.complete(new ByteArrayResponse(response.code(), response.headers().toMultimap(), body));
                } catch (IOException e) {
                    onFailure(call, e);
                }
            }
        });
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });
        return result;
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.hasBody()) {
            String contentType = request.headers().get("Content-Type");
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "HEAD" -> builder.head();
            case "DELETE" -> { if (body != null) builder.delete(body); else builder.delete(); }
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            case "PUT" -> builder.put(body != null ? body : RequestBody.create(new byte[0], null));
            case "PATCH" -> builder.patch(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }

    private static HttpClientException translate(HttpClientRequest request, IOException e) {
        if (e instanceof SocketTimeoutException) {
            return new HttpTimeoutException(request, e);
        }
        // OkHttp reports an expired call timeout as a plain InterruptedIOException("timeout").
        if (e instanceof InterruptedIOException && "timeout".equals(e.getMessage())) {
            SocketTimeoutException timeout = new SocketTimeoutException("call timeout");
            timeout.initCause(e);
            return new HttpTimeoutException(request, timeout);
        }
        return new HttpClientException(request, HttpClientException.describe(e), e);
    }
}
