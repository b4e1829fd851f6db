package io.kyhttp.client;

import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;
import io.kyhttp.http.spi.HttpClientException;
import io.kyhttp.http.spi.HttpClientRequest;
import io.kyhttp.http.spi.HttpClientResponse;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Conversions between the request model and the transport SPI.
 */
final class Exchanges {
    private Exchanges() {}

    static HttpClientRequest toHttpRequest(RequestSpec spec) {
        return HttpClientRequest.builder(spec.target(), spec.method().name())
                .headers(spec.headers())
                .body(spec.body().orElse(null))
                .build();
    }

    static Response toResponse(RequestSpec spec, int attempt, HttpClientResponse response) {
        return new Response(spec, attempt, response.statusCode(), response.headers(), response.body(), null);
    }

    /**
     * Builds the response of a failed asynchronous call, unwrapping the
     * completion wrappers around the transport error.
     */
    static Response failed(RequestSpec spec, int attempt, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        Exception transportError = cause instanceof Exception e ? e : new HttpClientException(cause);
        return Response.failed(spec, attempt, transportError);
    }
}
