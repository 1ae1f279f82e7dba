package io.apiclient.http.spi;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fully buffered response shared by the bundled adapters.
 */
final class ByteArrayResponse implements HttpClientResponse {
    private static final byte[] EMPTY = new byte[0];

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    ByteArrayResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {
        this.statusCode = statusCode;
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(headers);
        this.body = body == null ? EMPTY : body;
    }

    @Override public int statusCode() { return statusCode; }

    @Override
    public Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return Optional.ofNullable(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    @Override public Map<String, List<String>> headers() { return headers; }
    @Override public byte[] body() { return body; }

    @Override
    public String toString() {
        return "HttpClientResponse[" + statusCode + ", " + body.length + " bytes]";
    }
}
