package io.kyhttp.http.spi;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface lets kyhttp run on different HTTP client libraries
 * (JDK HttpClient, OkHttp, Apache HttpClient) without a direct dependency on
 * any of them. Implementations must be thread-safe and must allow many
 * {@link #sendAsync(HttpClientRequest) asynchronous} calls to be outstanding
 * at the same time.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com")).build();
 * HttpClientResponse response = adapter.send(request);
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends a request and blocks until the whole response body has been read.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as bytes
     * @throws HttpClientException if the request fails at the transport level
     * @throws HttpTimeoutException if the underlying client timed out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;

    /**
     * Starts sending a request without blocking the caller.
     *
     * <p>The returned future completes with the response, or exceptionally with
     * an {@link HttpClientException} on transport failure. The default
     * implementation runs {@link #send(HttpClientRequest)} on the common pool;
     * adapters over clients with native asynchronous support override it.
     *
     * @param request the HTTP request to send
     * @return a future for the response
     */
    default CompletableFuture<HttpClientResponse> sendAsync(HttpClientRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return send(request);
            } catch (HttpClientException e) {
                throw new CompletionException(e);
            }
        });
    }
}
