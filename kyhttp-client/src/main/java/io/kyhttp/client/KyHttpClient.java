package io.kyhttp.client;

import io.kyhttp.core.Method;
import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;
import io.kyhttp.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.util.List;

/**
 * Entry point: builds requests fluently and executes them singly or in batches.
 *
 * <pre>{@code
 * KyHttpClient http = KyHttpClient.create();
 *
 * Object json = http.get("https://example.com/get")
 *         .query(Map.of("a", 1))
 *         .retry(2)
 *         .sendJson();
 *
 * BatchQueue batch = http.newBatch();
 * http.get("https://example.com/a").addToBatch(batch);
 * http.get("https://example.com/b").addToBatch(batch);
 * List<Response> responses = http.sendBatch(batch);
 * }</pre>
 */
public interface KyHttpClient {

    FluentRequest request(Method method, String url);

    default FluentRequest get(String url) { return request(Method.GET, url); }
    default FluentRequest post(String url) { return request(Method.POST, url); }
    default FluentRequest put(String url) { return request(Method.PUT, url); }
    default FluentRequest patch(String url) { return request(Method.PATCH, url); }
    default FluentRequest delete(String url) { return request(Method.DELETE, url); }
    default FluentRequest head(String url) { return request(Method.HEAD, url); }

    /**
     * Sends the request, retrying 5xx responses and transport failures.
     *
     * @return the first accepted response (any status below 500)
     * @throws io.kyhttp.core.KyHttpException.RetriesExhausted if no attempt was accepted
     */
    Response send(RequestSpec spec);

    /**
     * Like {@link #send(RequestSpec)}, decoding the body as JSON.
     *
     * @return the decoded body, or null if the body is not JSON
     */
    Object sendJson(RequestSpec spec);

    /**
     * Creates an empty queue for {@link #sendBatch(BatchQueue)}.
     */
    BatchQueue newBatch();

    /**
     * Runs every queued request concurrently, retrying failed ones in later
     * rounds, and empties the queue. Exhausted requests are returned with their
     * last response rather than thrown.
     */
    List<Response> sendBatch(BatchQueue queue);

    /**
     * Like {@link #sendBatch(BatchQueue)}, decoding every body as JSON.
     */
    List<JsonResponse> sendBatchJson(BatchQueue queue);

    /**
     * The codec used for JSON bodies.
     *
     * @throws IllegalStateException if none was configured or discovered
     */
    JsonCodec jsonCodec();

    static KyHttpClient create() {
        return builder().build();
    }

    static KyHttpClient create(HttpClient httpClient) {
        return builder().jdkHttpClient(httpClient).build();
    }

    static KyHttpClientBuilder builder() {
        return new KyHttpClientBuilder();
    }
}
