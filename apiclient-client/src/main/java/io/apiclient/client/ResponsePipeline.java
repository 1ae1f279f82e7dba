package io.apiclient.client;

import io.apiclient.core.ClientError;
import io.apiclient.core.DecodeError;
import io.apiclient.core.Decoded;
import io.apiclient.core.Outcome;
import io.apiclient.core.RemoteEndpoint;
import io.apiclient.core.ResponseValidator;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns a transport result into an {@link Outcome}: validation, then decoding.
 * Shared by every call style and by the stub engine.
 */
final class ResponsePipeline {
    private ResponsePipeline() {}

    static <T> Outcome<T> process(RemoteEndpoint<T> endpoint, int statusCode, byte[] body) {
        return ResponseValidator.validate(statusCode, body, endpoint.acceptableStatusCode())
                .flatMap(bytes -> decode(endpoint, bytes));
    }

    /**
     * Runs the endpoint's decoder. A parser or transform that throws counts as a decode
     * failure, so every call style reports it the same way.
     */
    static <T> Outcome<T> decode(RemoteEndpoint<T> endpoint, byte[] bytes) {
        Decoded<T> decoded;
        try {
            decoded = endpoint.decode(bytes);
        } catch (RuntimeException e) {
            decoded = Decoded.failure(DecodeError.dataCorrupted("Decoder threw " + e, e));
        }
        if (decoded instanceof Decoded.Success<T> s) {
            return Outcome.success(s.value());
        }
        return Outcome.failure(new ClientError.DecodeFailure(((Decoded.Failure<T>) decoded).error()), bytes);
    }

    static <T> Outcome<T> transportFailure(Throwable error) {
        return Outcome.failure(new ClientError.TransportFailure(unwrap(error)), null);
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
