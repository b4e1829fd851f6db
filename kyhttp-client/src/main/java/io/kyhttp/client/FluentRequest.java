package io.kyhttp.client;

import io.kyhttp.core.AfterHook;
import io.kyhttp.core.BeforeHook;
import io.kyhttp.core.Headers;
import io.kyhttp.core.KyHttpException;
import io.kyhttp.core.Method;
import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;
import io.kyhttp.json.spi.JsonException;

import java.util.Map;
import java.util.Objects;

/**
 * Chainable request bound to a {@link KyHttpClient}.
 *
 * <p>Collects the request settings, then either runs it ({@link #send()},
 * {@link #sendJson()}) or queues it ({@link #addToBatch(BatchQueue)}). Each
 * terminal call builds a fresh {@link RequestSpec}, so a fluent request can be
 * reused.
 */
public final class FluentRequest {

    private final KyHttpClient client;
    private final RequestSpec.Builder spec;

    FluentRequest(KyHttpClient client, Method method, String url) {
        this.client = Objects.requireNonNull(client, "client");
        this.spec = RequestSpec.builder(method, url);
    }

    public FluentRequest header(String name, String value) {
        spec.header(name, value);
        return this;
    }

    public FluentRequest headers(Map<String, String> headers) {
        spec.headers(headers);
        return this;
    }

    /**
     * Replaces the query string; keys and values are percent-encoded in map order.
     */
    public FluentRequest query(Map<String, ?> params) {
        spec.query(params);
        return this;
    }

    /**
     * Encodes the value as the JSON body and sets {@code Content-Type: application/json}.
     *
     * @throws KyHttpException.InvalidRequest if the value cannot be encoded
     */
    public FluentRequest json(Object value) {
        try {
            spec.body(client.jsonCodec().writeBytes(value));
        } catch (JsonException e) {
            throw new KyHttpException.InvalidRequest("Cannot encode JSON body", e);
        }
        spec.header(Headers.CONTENT_TYPE, Headers.APPLICATION_JSON);
        return this;
    }

    public FluentRequest body(byte[] body, String contentType) {
        spec.body(body);
        if (contentType != null) {
            spec.header(Headers.CONTENT_TYPE, contentType);
        }
        return this;
    }

    /**
     * Additional attempts after the first for 5xx responses and transport failures.
     */
    public FluentRequest retry(int retry) {
        spec.retry(retry);
        return this;
    }

    public FluentRequest beforeRequest(BeforeHook hook) {
        spec.beforeRequest(hook);
        return this;
    }

    public FluentRequest afterResponse(AfterHook hook) {
        spec.afterResponse(hook);
        return this;
    }

    public RequestSpec build() {
        return spec.build();
    }

    public Response send() {
        return client.send(build());
    }

    public Object sendJson() {
        return client.sendJson(build());
    }

    public FluentRequest addToBatch(BatchQueue queue) {
        Objects.requireNonNull(queue, "queue").add(build());
        return this;
    }
}
