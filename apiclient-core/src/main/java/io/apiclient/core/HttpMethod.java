package io.apiclient.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Request method of an endpoint.
 *
 * <p>{@code POST}, {@code PUT} and {@code PATCH} may carry a body; the other methods never do.
 */
public final class HttpMethod {

    public static final HttpMethod OPTIONS = new HttpMethod("OPTIONS", null);
    public static final HttpMethod GET = new HttpMethod("GET", null);
    public static final HttpMethod HEAD = new HttpMethod("HEAD", null);
    public static final HttpMethod DELETE = new HttpMethod("DELETE", null);
    public static final HttpMethod TRACE = new HttpMethod("TRACE", null);
    public static final HttpMethod CONNECT = new HttpMethod("CONNECT", null);

    private final String name;
    private final byte[] body;

    private HttpMethod(String name, byte[] body) {
        this.name = name;
        this.body = body;
    }

    public static HttpMethod post() { return new HttpMethod("POST", null); }
    public static HttpMethod post(byte[] body) { return new HttpMethod("POST", copy(body)); }
    public static HttpMethod put() { return new HttpMethod("PUT", null); }
    public static HttpMethod put(byte[] body) { return new HttpMethod("PUT", copy(body)); }
    public static HttpMethod patch() { return new HttpMethod("PATCH", null); }
    public static HttpMethod patch(byte[] body) { return new HttpMethod("PATCH", copy(body)); }

    /**
     * Returns the method token sent on the wire, e.g. {@code "GET"}.
     */
    public String name() {
        return name;
    }

    /**
     * Returns a copy of the carried body, empty for methods without one.
     */
    public Optional<byte[]> body() {
        return Optional.ofNullable(copy(body));
    }

    private static byte[] copy(byte[] bytes) {
        return bytes == null ? null : bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpMethod)) return false;
        HttpMethod other = (HttpMethod) o;
        return name.equals(other.name) && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, Arrays.hashCode(body));
    }

    @Override
    public String toString() {
        return body == null ? name : name + "(" + body.length + " bytes)";
    }
}
