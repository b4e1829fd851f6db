package io.kyhttp.http.spi;

/**
 * Exception thrown when the underlying client reports a timeout.
 * Allows callers to distinguish timeout errors from other failures.
 */
public class HttpTimeoutException extends HttpClientException {

    public HttpTimeoutException(String message) {
        super(message);
    }

    public HttpTimeoutException(Throwable cause) {
        super(cause);
    }
}
