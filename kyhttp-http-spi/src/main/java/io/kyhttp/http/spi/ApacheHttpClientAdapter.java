package io.kyhttp.http.spi;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link HttpClientAdapter} implementation using the Apache HttpClient 5 classic API.
 *
 * <p>The classic client is blocking, so asynchronous calls run on the supplied
 * executor. Requires {@code org.apache.httpcomponents.client5:httpclient5} on the
 * classpath.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter, Closeable {

    private final CloseableHttpClient httpClient;
    private final ExecutorService executor;

    public ApacheHttpClientAdapter(CloseableHttpClient httpClient, ExecutorService executor) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public static ApacheHttpClientAdapter create() {
        return create(HttpClients.createDefault());
    }

    public static ApacheHttpClientAdapter create(CloseableHttpClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient, Executors.newCachedThreadPool(new NamedThreadFactory("kyhttp-apache")));
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpUriRequestBase apacheRequest = toApacheRequest(request);
            return httpClient.execute(apacheRequest, response -> {
                byte[] body = response.getEntity() != null
                        ? EntityUtils.toByteArray(response.getEntity())
                        : null;
                return new ByteArrayResponse(response.getCode(), response.getHeaders(), body);
            });
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (Exception e) {
            throw new HttpClientException(e);
        }
    }

    @Override
    public CompletableFuture<HttpClientResponse> sendAsync(HttpClientRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return send(request);
            } catch (HttpClientException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Closes the underlying client and stops the executor.
     */
    @Override
    public void close() throws IOException {
        executor.shutdown();
        httpClient.close();
    }

    private static HttpUriRequestBase toApacheRequest(HttpClientRequest request) {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        if (request.body() != null) {
            String contentType = contentType(request.headers());
            ContentType type = contentType != null ? ContentType.parse(contentType) : ContentType.APPLICATION_OCTET_STREAM;
            apacheRequest.setEntity(new ByteArrayEntity(request.body(), type));
        }

        request.headers().forEach(apacheRequest::setHeader);

        return apacheRequest;
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
        private final Header[] headers;
        private final byte[] body;

        ByteArrayResponse(int statusCode, Header[] headers, byte[] body) {
            this.statusCode = statusCode;
            this.headers = headers;
            this.body = body;
        }

        @Override public int statusCode() { return statusCode; }

        @Override
        public Optional<String> header(String name) {
            for (Header h : headers) {
                if (h.getName().equalsIgnoreCase(name)) {
                    return Optional.ofNullable(h.getValue());
                }
            }
            return Optional.empty();
        }

        @Override
        public Map<String, List<String>> headers() {
            Map<String, List<String>> out = new LinkedHashMap<>();
            for (Header h : headers) {
                out.computeIfAbsent(h.getName(), k -> new ArrayList<>()).add(h.getValue());
            }
            return Collections.unmodifiableMap(out);
        }

        @Override public byte[] body() { return body; }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
