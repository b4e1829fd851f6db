package io.kyhttp.http.spi;

/**
 * Exception thrown when an HTTP call fails at the transport level (connection
 * refused, DNS failure, reset). Wraps underlying implementation-specific
 * exceptions.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpClientException(Throwable cause) {
        super(cause);
    }
}
