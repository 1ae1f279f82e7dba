package io.apiclient.client;

import io.apiclient.core.ClientError;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Error type produced by {@link ErrorMapper#identity()}: the classified failure plus the raw
 * response body.
 */
public class ApiClientException extends Exception {

    private final ClientError error;
    private final byte[] body;

    public ApiClientException(ClientError error, byte[] body) {
        super(Objects.requireNonNull(error, "error").message(), causeOf(error));
        this.error = error;
        this.body = body == null ? null : body.clone();
    }

    public ClientError error() {
        return error;
    }

    public Optional<byte[]> body() {
        return Optional.ofNullable(body).map(byte[]::clone);
    }

    /**
     * Status code of the rejected response, if one was received.
     */
    public OptionalInt statusCode() {
        if (error instanceof ClientError.StatusRejected r) return OptionalInt.of(r.statusCode());
        if (error instanceof ClientError.EmptyBodyRejected r) return OptionalInt.of(r.statusCode());
        return OptionalInt.empty();
    }

    private static Throwable causeOf(ClientError error) {
        if (error instanceof ClientError.TransportFailure t) return t.cause();
        if (error instanceof ClientError.DecodeFailure d) return d.error().cause();
        return null;
    }
}
