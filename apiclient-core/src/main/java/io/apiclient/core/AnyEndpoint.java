package io.apiclient.core;

import java.util.Map;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * A {@link RemoteEndpoint} with its value type hidden.
 *
 * <p>Lets one closure handle endpoints of any result type, e.g. a stub that picks an error or
 * a canned body by path. Obtain instances with {@link RemoteEndpoint#erase()}.
 */
public final class AnyEndpoint {

    private final RemoteEndpoint<?> endpoint;

    AnyEndpoint(RemoteEndpoint<?> endpoint) {
        this.endpoint = endpoint;
    }

    public String path() {
        return endpoint.path();
    }

    public HttpMethod method() {
        return endpoint.method();
    }

    public Map<String, String> headers() {
        return endpoint.headers();
    }

    public Optional<Map<String, String>> parameters() {
        return endpoint.parameters();
    }

    public IntPredicate acceptableStatusCode() {
        return endpoint.acceptableStatusCode();
    }

    public Optional<byte[]> sampleData() {
        return endpoint.sampleData();
    }

    public Optional<BodyDecoder> decoder() {
        return endpoint.decoderOverride().map(DecoderOverride::decoder);
    }

    /**
     * Decodes {@code bytes} the way the underlying endpoint would, keeping only whether it
     * succeeded.
     */
    public DecodedValue parse(byte[] bytes) {
        return DecodedValue.of(endpoint.decode(bytes));
    }

    @Override
    public String toString() {
        return "AnyEndpoint[" + method().name() + " " + path() + "]";
    }
}
