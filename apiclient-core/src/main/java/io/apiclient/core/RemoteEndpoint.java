package io.apiclient.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.IntPredicate;

/**
 * Immutable description of one typed remote resource.
 *
 * <p>An endpoint is declared once and reused for every call. {@link #append} and {@link #map}
 * return new endpoints and never modify this one.
 *
 * <p>Example:
 * <pre>{@code
 * RemoteEndpoint<User> user = RemoteEndpoint.builder("/users/42", codec.parser(User.class))
 *     .header("Accept", "application/json")
 *     .sampleData("{\"id\":42,\"name\":\"a\"}".getBytes(StandardCharsets.UTF_8))
 *     .build();
 * }</pre>
 *
 * @param <T> the type the response body decodes to
 */
public final class RemoteEndpoint<T> {

    private final PathConvertible path;
    private final HttpMethod method;
    private final Map<String, String> headers;
    private final Map<String, String> parameters;
    private final IntPredicate acceptableStatusCode;
    private final byte[] sampleData;
    private final DecoderOverride<T> decoderOverride;
    private final Parser<T> parser;

    private RemoteEndpoint(Builder<T> b) {
        this.path = b.path;
        this.method = b.method;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.parameters = b.parameters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.parameters));
        this.acceptableStatusCode = b.acceptableStatusCode;
        this.sampleData = b.sampleData;
        this.decoderOverride = b.decoderOverride;
        this.parser = b.parser;
    }

    public static <T> Builder<T> builder(String path, Parser<T> parser) {
        return builder(PathConvertible.of(path), parser);
    }

    public static <T> Builder<T> builder(PathConvertible path, Parser<T> parser) {
        return new Builder<>(path, parser);
    }

    /**
     * Shortcut for a GET endpoint with default headers and status rule.
     */
    public static <T> RemoteEndpoint<T> get(String path, Parser<T> parser) {
        return builder(path, parser).build();
    }

    public String path() {
        return path.path();
    }

    public PathConvertible pathConvertible() {
        return path;
    }

    public HttpMethod method() {
        return method;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public Optional<Map<String, String>> parameters() {
        return Optional.ofNullable(parameters);
    }

    public IntPredicate acceptableStatusCode() {
        return acceptableStatusCode;
    }

    public Optional<byte[]> sampleData() {
        return Optional.ofNullable(sampleData).map(byte[]::clone);
    }

    public Optional<DecoderOverride<T>> decoderOverride() {
        return Optional.ofNullable(decoderOverride);
    }

    public Parser<T> parser() {
        return parser;
    }

    /**
     * Runs this endpoint's parse function.
     */
    public Decoded<T> parse(byte[] bytes) {
        return parser.parse(bytes);
    }

    /**
     * Decodes validated bytes: the decoder override when present, the parser otherwise.
     */
    public Decoded<T> decode(byte[] bytes) {
        if (decoderOverride != null) {
            return decoderOverride.decode(bytes);
        }
        return parser.parse(bytes);
    }

    /**
     * Returns an endpoint with {@code additional} merged into its headers. On a key conflict
     * the existing value is kept.
     */
    public RemoteEndpoint<T> append(Map<String, String> additional) {
        return append(additional, (existing, incoming) -> existing);
    }

    /**
     * Returns an endpoint with {@code additional} merged into its headers, resolving key
     * conflicts with {@code combine(existing, incoming)}.
     */
    public RemoteEndpoint<T> append(Map<String, String> additional, BinaryOperator<String> combine) {
        Objects.requireNonNull(additional, "additional");
        Objects.requireNonNull(combine, "combine");
        Map<String, String> merged = new LinkedHashMap<>(headers);
        additional.forEach((k, v) -> merged.merge(k, v, combine));
        return toBuilder().headers(merged).build();
    }

    /**
     * Returns an endpoint that decodes as this one does and then applies {@code transform}.
     * Every other field, including sample data and decoder override, is carried over.
     */
    public <U> RemoteEndpoint<U> map(Function<? super T, ? extends U> transform) {
        Objects.requireNonNull(transform, "transform");
        Builder<U> b = new Builder<>(path, parser.map(transform));
        b.method = method;
        b.headers = headers;
        b.parameters = parameters;
        b.acceptableStatusCode = acceptableStatusCode;
        b.sampleData = sampleData;
        b.decoderOverride = decoderOverride == null ? null : decoderOverride.map(transform);
        return new RemoteEndpoint<>(b);
    }

    /**
     * Projects this endpoint to an {@link AnyEndpoint} that hides {@code T}.
     */
    public AnyEndpoint erase() {
        return new AnyEndpoint(this);
    }

    public Builder<T> toBuilder() {
        Builder<T> b = new Builder<>(path, parser);
        b.method = method;
        b.headers = new LinkedHashMap<>(headers);
        b.parameters = parameters == null ? null : new LinkedHashMap<>(parameters);
        b.acceptableStatusCode = acceptableStatusCode;
        b.sampleData = sampleData;
        b.decoderOverride = decoderOverride;
        return b;
    }

    @Override
    public String toString() {
        return "RemoteEndpoint[" + method.name() + " " + path.path() + "]";
    }

    public static final class Builder<T> {
        private final PathConvertible path;
        private final Parser<T> parser;
        private HttpMethod method = HttpMethod.GET;
        private Map<String, String> headers = new LinkedHashMap<>();
        private Map<String, String> parameters;
        private IntPredicate acceptableStatusCode = StatusCodes::expected200to300;
        private byte[] sampleData;
        private DecoderOverride<T> decoderOverride;

        private Builder(PathConvertible path, Parser<T> parser) {
            this.path = Objects.requireNonNull(path, "path");
            this.parser = Objects.requireNonNull(parser, "parser");
        }

        public Builder<T> method(HttpMethod method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder<T> header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.put(name, value);
            return this;
        }

        /**
         * Replaces all headers.
         */
        public Builder<T> headers(Map<String, String> headers) {
            Objects.requireNonNull(headers, "headers");
            this.headers = new LinkedHashMap<>(headers);
            return this;
        }

        public Builder<T> parameter(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (parameters == null) parameters = new LinkedHashMap<>();
            parameters.put(name, value);
            return this;
        }

        /**
         * Replaces all query parameters; {@code null} means none.
         */
        public Builder<T> parameters(Map<String, String> parameters) {
            this.parameters = parameters == null ? null : new LinkedHashMap<>(parameters);
            return this;
        }

        public Builder<T> acceptableStatusCode(IntPredicate acceptableStatusCode) {
            this.acceptableStatusCode = Objects.requireNonNull(acceptableStatusCode, "acceptableStatusCode");
            return this;
        }

        /**
         * Canned body used only when the client is stubbed.
         */
        public Builder<T> sampleData(byte[] sampleData) {
            this.sampleData = sampleData == null ? null : sampleData.clone();
            return this;
        }

        public Builder<T> decoderOverride(DecoderOverride<T> decoderOverride) {
            this.decoderOverride = decoderOverride;
            return this;
        }

        public Builder<T> decoder(BodyDecoder decoder, ValueType<T> type) {
            return decoderOverride(DecoderOverride.of(decoder, type));
        }

        public RemoteEndpoint<T> build() {
            return new RemoteEndpoint<>(this);
        }
    }
}
