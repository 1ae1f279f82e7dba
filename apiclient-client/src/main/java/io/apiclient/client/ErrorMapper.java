package io.apiclient.client;

import io.apiclient.core.ClientError;

/**
 * Converts a classified failure into the caller's error type.
 *
 * <p>Invoked exactly once per failed call, for real and stubbed calls alike, except for
 * {@link StubBehavior.ImmediateError} whose error is already in the caller's type.
 *
 * @param <E> the caller's error type
 */
@FunctionalInterface
public interface ErrorMapper<E extends Exception> {

    /**
     * @param error the classified failure
     * @param body raw response bytes, or null when no response was obtained
     * @return the caller's error, never null
     */
    E map(ClientError error, byte[] body);

    /**
     * Wraps every failure in an {@link ApiClientException}.
     */
    static ErrorMapper<ApiClientException> identity() {
        return ApiClientException::new;
    }
}
