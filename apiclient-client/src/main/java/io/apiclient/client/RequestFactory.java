package io.apiclient.client;

import io.apiclient.core.RemoteEndpoint;
import io.apiclient.core.Urls;
import io.apiclient.http.spi.HttpClientRequest;

import java.net.URI;
import java.time.Duration;

/**
 * Builds the transport request for an endpoint whose headers are already merged with the
 * client defaults.
 */
final class RequestFactory {
    private RequestFactory() {}

    /**
     * @throws io.apiclient.core.MalformedRequestException if base URL, path and query do not
     *         form an absolute URI
     */
    static HttpClientRequest create(String baseUrl, RemoteEndpoint<?> endpoint, Duration timeout) {
        String url = Urls.withQuery(baseUrl + endpoint.path(), endpoint.parameters().orElse(null));
        URI uri = Urls.toAbsoluteUri(url);

        HttpClientRequest.Builder builder = HttpClientRequest.builder(uri, endpoint.method().name())
                .headers(endpoint.headers())
                .timeout(timeout);
        endpoint.method().body().ifPresent(builder::body);
        return builder.build();
    }
}
