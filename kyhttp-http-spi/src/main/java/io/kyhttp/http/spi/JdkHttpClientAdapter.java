package io.kyhttp.http.spi;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 * This is the default implementation when no other HTTP client library is configured.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient that follows redirects.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpRequest jdkRequest = toJdkRequest(request);
            HttpResponse<byte[]> response = httpClient.send(jdkRequest, HttpResponse.BodyHandlers.ofByteArray());
            return new ByteArrayResponse(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Request interrupted", e);
        } catch (Exception e) {
            throw translate(e);
        }
    }

    @Override
    public CompletableFuture<HttpClientResponse> sendAsync(HttpClientRequest request) {
        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        HttpRequest jdkRequest;
        try {
            jdkRequest = toJdkRequest(request);
        } catch (RuntimeException e) {
            result.completeExceptionally(translate(e));
            return result;
        }
        httpClient.sendAsync(jdkRequest, HttpResponse.BodyHandlers.ofByteArray())
                .whenComplete((response, error) -> {
                    if (error != null) {
                        result.completeExceptionally(translate(unwrap(error)));
                    } else {
                        result.complete(new ByteArrayResponse(response));
                    }
                });
        return result;
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());

        HttpRequest.BodyPublisher bodyPublisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        builder.method(request.method(), bodyPublisher);
        request.headers().forEach(builder::header);

        return builder.build();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cur = error;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static HttpClientException translate(Throwable error) {
        if (error instanceof HttpClientException e) {
            return e;
        }
        if (error instanceof java.net.http.HttpTimeoutException) {
            return new HttpTimeoutException(error);
        }
        if (error instanceof IOException) {
            return new HttpClientException(error);
        }
        return new HttpClientException("Request failed: " + error, error);
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final HttpResponse<byte[]> response;

        ByteArrayResponse(HttpResponse<byte[]> response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public Map<String, List<String>> headers() {
            return response.headers().map();
        }

        @Override
        public byte[] body() {
            return response.body();
        }
    }
}
