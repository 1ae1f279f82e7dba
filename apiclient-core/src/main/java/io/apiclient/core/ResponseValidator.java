package io.apiclient.core;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Checks an HTTP response before its body is decoded.
 *
 * <p>The status is checked against the endpoint's acceptance rule first; then every status
 * except 204 must come with a non-empty body. Transport failures never reach this class.
 */
public final class ResponseValidator {
    private static final byte[] EMPTY = new byte[0];

    private ResponseValidator() {}

    public static Outcome<byte[]> validate(int statusCode, byte[] body, IntPredicate acceptableStatusCode) {
        Objects.requireNonNull(acceptableStatusCode, "acceptableStatusCode");
        byte[] bytes = body == null ? EMPTY : body;

        if (!acceptableStatusCode.test(statusCode)) {
            return Outcome.failure(new ClientError.StatusRejected(statusCode), bytes);
        }
        if (StatusCodes.requiresBody(statusCode) && bytes.length == 0) {
            return Outcome.failure(new ClientError.EmptyBodyRejected(statusCode), bytes);
        }
        return Outcome.success(bytes);
    }
}
