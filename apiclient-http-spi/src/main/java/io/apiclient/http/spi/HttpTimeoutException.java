package io.apiclient.http.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * No response arrived within the request's timeout.
 */
public class HttpTimeoutException extends HttpClientException {

    public HttpTimeoutException(HttpClientRequest request, Throwable cause) {
        super(request, "timed out" + (request.timeout() == null ? "" : " after " + request.timeout().toMillis() + " ms"), cause);
    }

    /**
     * The timeout that elapsed, if one was set on the request.
     */
    public Optional<Duration> timeout() {
        return request().map(HttpClientRequest::timeout);
    }
}
