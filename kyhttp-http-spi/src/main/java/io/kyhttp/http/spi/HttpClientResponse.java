package io.kyhttp.http.spi;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}, with the body
 * fully read into memory.
 */
public interface HttpClientResponse {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns all response headers.
     */
    Map<String, List<String>> headers();

    /**
     * Returns the response body as a byte array.
     * @return the body bytes, or null if the response had no body
     */
    byte[] body();
}
