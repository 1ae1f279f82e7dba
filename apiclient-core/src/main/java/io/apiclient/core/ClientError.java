package io.apiclient.core;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Closed set of ways a call can fail before it reaches the caller's error type.
 *
 * <p>Every failed call produces exactly one of these, which the client hands to its error
 * mapper together with the raw response bytes, if any. Stubbed calls produce the same
 * variants as real ones.
 */
public sealed interface ClientError permits ClientError.TransportFailure, ClientError.StatusRejected,
        ClientError.EmptyBodyRejected, ClientError.DecodeFailure, ClientError.MissingSampleData {

    String message();

    /**
     * The transport reported an error and no response was obtained. Timeouts land here.
     *
     * @param cause the transport exception
     */
    record TransportFailure(Throwable cause) implements ClientError {
        public TransportFailure {
            Objects.requireNonNull(cause, "cause");
        }

        /**
         * Whether the cause chain holds one of the JDK's timeout exceptions. Transports wrap
         * their own timeout signals around one of these.
         */
        public boolean isTimeout() {
            Throwable t = cause;
            while (t != null) {
                if (t instanceof TimeoutException
                        || t instanceof SocketTimeoutException
                        || t instanceof HttpTimeoutException) {
                    return true;
                }
                t = t.getCause();
            }
            return false;
        }

        @Override
        public String message() {
            return "Transport failure: " + (cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage());
        }
    }

    /**
     * A response arrived but the endpoint's acceptance rule rejected its status.
     */
    record StatusRejected(int statusCode) implements ClientError {
        @Override
        public String message() {
            return "Unacceptable status code " + statusCode;
        }
    }

    /**
     * A response arrived with a status that requires a body, but the body was empty.
     */
    record EmptyBodyRejected(int statusCode) implements ClientError {
        @Override
        public String message() {
            return "Empty body for status code " + statusCode;
        }
    }

    record DecodeFailure(DecodeError error) implements ClientError {
        public DecodeFailure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String message() {
            return "Decode failure: " + error.describe();
        }
    }

    /**
     * A stub was asked to answer from sample data the endpoint does not have.
     *
     * @param path path of the endpoint lacking sample data
     */
    record MissingSampleData(String path) implements ClientError {
        public MissingSampleData {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String message() {
            return "No sample data for endpoint " + path;
        }
    }
}
