package io.apiclient.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully resolved request: absolute URI with query, method token, headers in the order they
 * were set, optional body and optional per-request timeout.
 *
 * @param uri absolute request URI
 * @param method wire token such as {@code GET} or {@code PATCH}
 * @param headers header values, one per name
 * @param body request body, or null
 * @param timeout response timeout, or null for the transport's default
 */
public record HttpClientRequest(URI uri, String method, Map<String, String> headers, byte[] body, Duration timeout) {

    public HttpClientRequest {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(method, "method");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    public static Builder get(URI uri) { return new Builder(uri, "GET"); }
    public static Builder put(URI uri) { return new Builder(uri, "PUT"); }
    public static Builder delete(URI uri) { return new Builder(uri, "DELETE"); }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        /**
         * Sets a header, overwriting any previous value for the same name.
         */
        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(uri, method, headers, body, timeout);
        }
    }
}
