package io.kyhttp.client;

import io.kyhttp.http.spi.HttpClientAdapter;
import io.kyhttp.http.spi.JdkHttpClientAdapter;
import io.kyhttp.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Builder for {@link KyHttpClient}.
 *
 * <p>Allows configuring the transport, the JSON codec and the batch poll
 * interval. Unset values fall back to a JDK HttpClient transport that follows
 * redirects, the codec found through {@link java.util.ServiceLoader}, and
 * {@link BatchExecutor#DEFAULT_POLL_INTERVAL}.
 */
public final class KyHttpClientBuilder {
    private HttpClientAdapter transport;
    private JsonCodec jsonCodec;
    private Duration pollInterval = BatchExecutor.DEFAULT_POLL_INTERVAL;

    /**
     * Sets a custom transport implementation.
     *
     * @param transport the transport to use
     * @return this builder
     */
    public KyHttpClientBuilder transport(HttpClientAdapter transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    /**
     * Uses the JDK HttpClient transport with a provided HttpClient instance.
     *
     * @param httpClient the JDK HttpClient to use
     * @return this builder
     */
    public KyHttpClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public KyHttpClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Upper bound of each wait while a batch round is in flight.
     */
    public KyHttpClientBuilder pollInterval(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.pollInterval = pollInterval;
        return this;
    }

    public KyHttpClient build() {
        HttpClientAdapter resolved = transport;
        if (resolved == null) {
            resolved = JdkHttpClientAdapter.create();
        }
        return new DefaultKyHttpClient(resolved, jsonCodec, pollInterval);
    }
}
