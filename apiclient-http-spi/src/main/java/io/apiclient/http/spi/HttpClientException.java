package io.apiclient.http.spi;

import java.util.Optional;

/**
 * An exchange produced no response: the request could not be sent, the connection failed or
 * the transport gave up waiting.
 */
public class HttpClientException extends Exception {

    private final transient HttpClientRequest request;

    public HttpClientException(String message) {
        this(null, message, null);
    }

    public HttpClientException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public HttpClientException(HttpClientRequest request, String message, Throwable cause) {
        super(request == null ? message : request + ": " + message, cause);
        this.request = request;
    }

    /**
     * The request whose exchange failed, when the adapter knows it.
     */
    public Optional<HttpClientRequest> request() {
        return Optional.ofNullable(request);
    }

    static String describe(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
