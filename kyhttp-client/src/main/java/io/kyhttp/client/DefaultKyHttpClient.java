package io.kyhttp.client;

import io.kyhttp.core.Method;
import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;
import io.kyhttp.http.spi.HttpClientAdapter;
import io.kyhttp.json.spi.JsonCodec;
import io.kyhttp.json.spi.JsonCodecs;
import io.kyhttp.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

final class DefaultKyHttpClient implements KyHttpClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultKyHttpClient.class);

    private final SingleRequestExecutor single;
    private final BatchExecutor batch;
    private final JsonCodec configuredCodec;
    private volatile JsonCodec discoveredCodec;

    DefaultKyHttpClient(HttpClientAdapter transport, JsonCodec jsonCodec, Duration pollInterval) {
        Objects.requireNonNull(transport, "transport");
        this.single = new SingleRequestExecutor(transport);
        this.batch = new BatchExecutor(transport, pollInterval);
        this.configuredCodec = jsonCodec;
    }

    @Override
    public FluentRequest request(Method method, String url) {
        return new FluentRequest(this, method, url);
    }

    @Override
    public Response send(RequestSpec spec) {
        return single.send(spec);
    }

    @Override
    public Object sendJson(RequestSpec spec) {
        return decodeOrNull(send(spec));
    }

    @Override
    public BatchQueue newBatch() {
        return new BatchQueue();
    }

    @Override
    public List<Response> sendBatch(BatchQueue queue) {
        return batch.runBatch(queue);
    }

    @Override
    public List<JsonResponse> sendBatchJson(BatchQueue queue) {
        List<Response> responses = sendBatch(queue);
        List<JsonResponse> out = new ArrayList<>(responses.size());
        for (Response r : responses) {
            out.add(new JsonResponse(r, decodeOrNull(r)));
        }
        return out;
    }

    @Override
    public JsonCodec jsonCodec() {
        if (configuredCodec != null) {
            return configuredCodec;
        }
        JsonCodec codec = discoveredCodec;
        if (codec == null) {
            codec = JsonCodecs.discover().orElseThrow(() -> new IllegalStateException(
                    "No JsonCodec configured or found on the classpath; add kyhttp-json-jackson or call jsonCodec(...)"));
            discoveredCodec = codec;
        }
        return codec;
    }

    private Object decodeOrNull(Response response) {
        try {
            return jsonCodec().readValue(response.body(), Object.class);
        } catch (JsonException e) {
            log.debug("{} body is not JSON: {}", response.request(), e.getMessage());
            return null;
        }
    }
}
