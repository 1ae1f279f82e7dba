package io.apiclient.core;

/**
 * Raised when the base URL, path and query of an endpoint do not form a valid absolute URI.
 *
 * <p>This is a programming error in how the client or endpoint was configured. It is thrown
 * immediately and never passed through the client's error mapper.
 */
public class MalformedRequestException extends IllegalArgumentException {

    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
