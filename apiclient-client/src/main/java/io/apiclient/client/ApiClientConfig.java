package io.apiclient.client;

import io.apiclient.http.spi.HttpClientAdapter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of an {@link ApiClient}.
 *
 * @param baseUrl prefix of every request URL; endpoint paths are appended verbatim
 * @param headers initial default headers
 * @param errorMapper converts classified failures into the caller's error type
 * @param httpClient transport used for non-stubbed calls
 * @param timeout per-request timeout handed to the transport, or null for the transport's default
 * @param stubBehavior initial stub behavior, or null
 */
public record ApiClientConfig<E extends Exception>(
        String baseUrl,
        Map<String, String> headers,
        ErrorMapper<E> errorMapper,
        HttpClientAdapter httpClient,
        Duration timeout,
        StubBehavior<E> stubBehavior) {

    public ApiClientConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(errorMapper, "errorMapper");
        Objects.requireNonNull(httpClient, "httpClient");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
