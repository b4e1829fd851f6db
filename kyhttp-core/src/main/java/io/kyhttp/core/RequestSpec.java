package io.kyhttp.core;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one HTTP call.
 *
 * <p>A spec carries everything an executor needs: method, URL, headers, the
 * encoded query string, an optional body, the retry budget and the hooks. It
 * holds no execution state; attempt counting belongs to the executor running
 * it, so the same spec can be sent or queued any number of times.
 */
public final class RequestSpec {

    private final Method method;
    private final String url;
    private final Map<String, String> headers;
    private final String queryString;
    private final byte[] body;
    private final int retry;
    private final BeforeHook beforeHook;
    private final AfterHook afterHook;

    private RequestSpec(Builder b) {
        this.method = b.method;
        this.url = b.url;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.queryString = b.queryString;
        this.body = b.body == null ? null : b.body.clone();
        this.retry = b.retry;
        this.beforeHook = b.beforeHook;
        this.afterHook = b.afterHook;
    }

    public Method method() { return method; }
    public String url() { return url; }
    public Map<String, String> headers() { return headers; }
    public String queryString() { return queryString; }
    public int retry() { return retry; }
    public Optional<BeforeHook> beforeHook() { return Optional.ofNullable(beforeHook); }
    public Optional<AfterHook> afterHook() { return Optional.ofNullable(afterHook); }

    /**
     * Returns a copy of the body, or empty if the request has none.
     */
    public Optional<byte[]> body() {
        return body == null ? Optional.empty() : Optional.of(body.clone());
    }

    /**
     * Total number of attempts allowed: the first one plus {@link #retry()}.
     */
    public int maxAttempts() {
        return retry + 1;
    }

    /**
     * The URL actually requested, with the query string appended.
     */
    public URI target() {
        return URI.create(Urls.withQuery(url, queryString));
    }

    /**
     * Returns a builder pre-populated with this spec's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder(method, url);
        b.headers.putAll(headers);
        b.queryString = queryString;
        b.body = body;
        b.retry = retry;
        b.beforeHook = beforeHook;
        b.afterHook = afterHook;
        return b;
    }

    public static Builder builder(Method method, String url) {
        return new Builder(method, url);
    }

    public static Builder get(String url) { return new Builder(Method.GET, url); }
    public static Builder post(String url) { return new Builder(Method.POST, url); }

    @Override
    public String toString() {
        return method + " " + Urls.withQuery(url, queryString);
    }

    public static final class Builder {
        private final Method method;
        private final String url;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String queryString = "";
        private byte[] body;
        private int retry;
        private BeforeHook beforeHook;
        private AfterHook afterHook;

        private Builder(Method method, String url) {
            this.method = Objects.requireNonNull(method, "method");
            this.url = url;
        }

        /**
         * Sets a header; a later call with the same name replaces the value.
         */
        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        /**
         * Replaces the query string with the encoded parameters.
         */
        public Builder query(Map<String, ?> params) {
            this.queryString = Urls.queryString(params);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        /**
         * Number of additional attempts after the first; negative values become 0.
         */
        public Builder retry(int retry) {
            this.retry = Math.max(0, retry);
            return this;
        }

        public Builder beforeRequest(BeforeHook hook) {
            this.beforeHook = hook;
            return this;
        }

        public Builder afterResponse(AfterHook hook) {
            this.afterHook = hook;
            return this;
        }

        /**
         * @throws KyHttpException.InvalidRequest if the URL is missing or not absolute
         */
        public RequestSpec build() {
            if (url == null || url.isBlank()) {
                throw new KyHttpException.InvalidRequest("Request URL is required");
            }
            URI parsed;
            try {
                parsed = URI.create(Urls.withQuery(url, queryString));
            } catch (IllegalArgumentException e) {
                throw new KyHttpException.InvalidRequest("Malformed request URL: " + url, e);
            }
            if (!parsed.isAbsolute()) {
                throw new KyHttpException.InvalidRequest("Request URL must be absolute: " + url);
            }
            return new RequestSpec(this);
        }
    }
}
