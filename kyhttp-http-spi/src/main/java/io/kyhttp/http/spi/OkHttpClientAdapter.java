package io.kyhttp.http.spi;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Asynchronous calls go through {@link Call#enqueue(Callback)}, so they run on
 * the client's dispatcher. Requires {@code com.squareup.okhttp3:okhttp} on the
 * classpath.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        Request okRequest;
        try {
            okRequest = toOkHttpRequest(request);
        } catch (RuntimeException e) {
            throw invalid(e);
        }
        try (Response response = httpClient.newCall(okRequest).execute()) {
            return new ByteArrayResponse(response);
        } catch (IOException e) {
            throw translate(e);
        }
    }

    @Override
    public CompletableFuture<HttpClientResponse> sendAsync(HttpClientRequest request) {
        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        Request okRequest;
        try {
            okRequest = toOkHttpRequest(request);
        } catch (RuntimeException e) {
            result.completeExceptionally(invalid(e));
            return result;
        }
        httpClient.newCall(okRequest).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                result.completeExceptionally(translate(e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    result.complete(new ByteArrayResponse(response));
                } catch (IOException e) {
                    result.completeExceptionally(translate(e));
                }
            }
        });
        return result;
    }

    private static HttpClientException invalid(RuntimeException e) {
        return new HttpClientException("Invalid request: " + e.getMessage(), e);
    }

    private static HttpClientException translate(IOException e) {
        if (e instanceof SocketTimeoutException || (e instanceof InterruptedIOException && "timeout".equals(e.getMessage()))) {
            return new HttpTimeoutException(e);
        }
        return new HttpClientException(e);
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.body() != null) {
            String contentType = contentType(request.headers());
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "HEAD" -> builder.head();
            case "DELETE" -> { if (body != null) builder.delete(body); else builder.delete(); }
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            case "PUT" -> builder.put(body != null ? body : RequestBody.create(new byte[0], null));
            case "PATCH" -> builder.patch(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }

    private static String contentType(Map<String, String> headers) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase("Content-Type")) {
                return e.getValue();
            }
        }
        return null;
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final int statusCode;
        private final Map<String, List<String>> headers;
        private final byte[] body;

        ByteArrayResponse(Response response) throws IOException {
            this.statusCode = response.code();
            this.headers = response.headers().toMultimap();
            ResponseBody responseBody = response.body();
            this.body = responseBody != null ? responseBody.bytes() : null;
        }

        @Override public int statusCode() { return statusCode; }

        @Override
        public Optional<String> header(String name) {
            for (Map.Entry<String, List<String>> e : headers.entrySet()) {
                if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                    return Optional.ofNullable(e.getValue().get(0));
                }
            }
            return Optional.empty();
        }

        @Override public Map<String, List<String>> headers() { return headers; }
        @Override public byte[] body() { return body; }
    }
}
