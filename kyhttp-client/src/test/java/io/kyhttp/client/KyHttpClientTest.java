package io.kyhttp.client;

import io.kyhttp.core.KyHttpException;
import io.kyhttp.core.Response;
import io.kyhttp.http.spi.HttpClientException;
import io.kyhttp.http.spi.OkHttpClientAdapter;
import io.kyhttp.json.jackson.JacksonJsonCodec;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KyHttpClientTest {

    private MockWebServer server;
    private KyHttpClient client;
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new EchoDispatcher());
        server.start();
        client = KyHttpClient.builder()
                .pollInterval(Duration.ofMillis(20))
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void getDecodesJson() {
        Object res = client.get(url("/get")).sendJson();

        assertThat(res).isInstanceOf(Map.class);
        assertThat((String) ((Map<?, ?>) res).get("url")).endsWith("/get");
    }

    @Test
    void queryParametersAreEncodedInOrder() throws Exception {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("a", 1);
        query.put("b", "test value");

        Map<?, ?> res = (Map<?, ?>) client.get(url("/get")).query(query).sendJson();

        assertThat(res.get("args")).isEqualTo(Map.of("a", "1", "b", "test value"));
        assertThat(server.takeRequest().getPath()).isEqualTo("/get?a=1&b=test%20value");
    }

    @Test
    void customHeadersAreSent() {
        Map<?, ?> res = (Map<?, ?>) client.get(url("/headers")).header("X-Test", "KyHttp").sendJson();

        assertThat(((Map<?, ?>) res.get("headers")).get("X-Test")).isEqualTo("KyHttp");
    }

    @Test
    void postJsonBody() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "KyHttp");
        body.put("speed", "fast");

        Map<?, ?> res = (Map<?, ?>) client.post(url("/post")).json(body).sendJson();

        assertThat(res.get("json")).isEqualTo(Map.of("name", "KyHttp", "speed", "fast"));
        assertThat(server.takeRequest().getHeader("Content-Type")).startsWith("application/json");
    }

    @Test
    void hooksRunAroundTheCall() {
        AtomicBoolean beforeCalled = new AtomicBoolean();
        AtomicBoolean afterCalled = new AtomicBoolean();

        Response res = client.get(url("/get"))
                .beforeRequest(r -> beforeCalled.set(true))
                .afterResponse(r -> afterCalled.set(true))
                .send();

        assertThat(res.status()).isEqualTo(200);
        assertThat(beforeCalled).isTrue();
        assertThat(afterCalled).isTrue();
    }

    @Test
    void serverErrorIsRetriedThenRaised() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> client.get(url("/status/500"))
                .retry(2)
                .afterResponse(r -> attempts.incrementAndGet())
                .send())
                .isInstanceOf(KyHttpException.RetriesExhausted.class);

        assertThat(attempts).hasValue(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void clientErrorIsReturnedOnFirstAttempt() {
        Response res = client.get(url("/status/404")).retry(5).send();

        assertThat(res.status()).isEqualTo(404);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void batchReturnsEveryResponse() {
        BatchQueue batch = client.newBatch();
        client.get(url("/get")).addToBatch(batch);
        client.get(url("/uuid")).addToBatch(batch);
        client.get(url("/ip")).addToBatch(batch);

        List<Response> responses = client.sendBatch(batch);

        assertThat(responses).hasSize(3).allMatch(r -> r.status() == 200);
        assertThat(batch.isEmpty()).isTrue();
    }

    @Test
    void batchJsonDecodesBodies() {
        BatchQueue batch = client.newBatch();
        client.get(url("/get")).addToBatch(batch);
        client.get(url("/uuid")).addToBatch(batch);

        List<JsonResponse> responses = client.sendBatchJson(batch);

        assertThat(responses).hasSize(2);
        assertThat(responses).allSatisfy(r -> assertThat(r.json()).isInstanceOf(Map.class));
    }

    @Test
    void batchRetriesFlakyRequestAfterSiblingsComplete() {
        BatchQueue batch = client.newBatch();
        client.get(url("/flaky")).retry(2).addToBatch(batch);
        client.get(url("/get")).addToBatch(batch);

        List<Response> responses = client.sendBatch(batch);

        assertThat(responses).extracting(r -> r.request().url()).containsExactly(url("/get"), url("/flaky"));
        assertThat(responses.get(1).status()).isEqualTo(200);
        assertThat(hits.get("/flaky")).hasValue(3);
    }

    @Test
    void batchReturnsExhaustedServerError() {
        BatchQueue batch = client.newBatch();
        client.get(url("/status/500")).retry(1).addToBatch(batch);

        List<Response> responses = client.sendBatch(batch);

        assertThat(responses).extracting(Response::status).containsExactly(500);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void nonJsonBodyDecodesToNull() {
        assertThat(client.get(url("/html")).sendJson()).isNull();

        BatchQueue batch = client.newBatch();
        client.get(url("/html")).addToBatch(batch);
        List<JsonResponse> responses = client.sendBatchJson(batch);

        assertThat(responses).singleElement().satisfies(r -> {
            assertThat(r.status()).isEqualTo(200);
            assertThat(r.json()).isNull();
        });
    }

    @Test
    void bodyWithTrailingContentDecodesToNull() {
        assertThat(client.get(url("/trailing/object")).sendJson()).isNull();
        assertThat(client.get(url("/trailing/array")).sendJson()).isNull();
        assertThat(client.get(url("/trailing/number")).sendJson()).isNull();

        BatchQueue batch = client.newBatch();
        client.get(url("/trailing/object")).addToBatch(batch);
        client.get(url("/trailing/array")).addToBatch(batch);

        assertThat(client.sendBatchJson(batch)).hasSize(2).allSatisfy(r -> assertThat(r.json()).isNull());
    }

    @Test
    void headerRejectedByOkHttpIsRetriedAsTransportError() {
        KyHttpClient okClient = KyHttpClient.builder()
                .transport(OkHttpClientAdapter.create())
                .build();

        assertThatThrownBy(() -> okClient.get(url("/get")).header("X-Name", "\u017daba").retry(2).send())
                .isInstanceOfSatisfying(KyHttpException.RetriesExhausted.class, e -> {
                    assertThat(e.attempts()).isEqualTo(3);
                    assertThat(e.lastResponse().isTransportError()).isTrue();
                    assertThat(e.lastResponse().error()).isInstanceOf(HttpClientException.class);
                });
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void chainedSettingsAreAllApplied() {
        Map<?, ?> res = (Map<?, ?>) client.get(url("/get"))
                .header("X-One", "1")
                .query(Map.of("chain", "yes"))
                .retry(1)
                .sendJson();

        assertThat(res.get("args")).isEqualTo(Map.of("chain", "yes"));
    }

    @Test
    void unreachableHostInBatchYieldsTransportErrorResponse() throws Exception {
        MockWebServer gone = new MockWebServer();
        gone.start();
        String deadUrl = gone.url("/dead").toString();
        gone.shutdown();

        BatchQueue batch = client.newBatch();
        client.get(deadUrl).retry(1).addToBatch(batch);
        client.get(url("/get")).addToBatch(batch);

        List<Response> responses = client.sendBatch(batch);

        assertThat(responses).hasSize(2);
        Response dead = responses.get(1);
        assertThat(dead.request().url()).isEqualTo(deadUrl);
        assertThat(dead.isTransportError()).isTrue();
        assertThat(dead.attempt()).isEqualTo(2);
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    private final class EchoDispatcher extends Dispatcher {
        private final JacksonJsonCodec json = new JacksonJsonCodec();

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            HttpUrl requestUrl = request.getRequestUrl();
            String path = requestUrl.encodedPath();
            int hit = hits.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();
            try {
                switch (path) {
                    case "/get": {
                        Map<String, Object> args = new LinkedHashMap<>();
                        for (String name : requestUrl.queryParameterNames()) {
                            args.put(name, requestUrl.queryParameter(name));
                        }
                        Map<String, Object> out = new LinkedHashMap<>();
                        out.put("url", requestUrl.newBuilder().query(null).build().toString());
                        out.put("args", args);
                        return jsonResponse(out);
                    }
                    case "/headers": {
                        Map<String, Object> headers = new LinkedHashMap<>();
                        for (String name : request.getHeaders().names()) {
                            headers.put(name, request.getHeader(name));
                        }
                        return jsonResponse(Map.of("headers", headers));
                    }
                    case "/post":
                        return jsonResponse(Map.of("json", json.readValue(request.getBody().readUtf8(), Object.class)));
                    case "/uuid":
                        return jsonResponse(Map.of("uuid", UUID.randomUUID().toString()));
                    case "/ip":
                        return jsonResponse(Map.of("origin", "127.0.0.1"));
                    case "/flaky":
                        return hit <= 2 ? new MockResponse().setResponseCode(503) : jsonResponse(Map.of("ok", true));
                    case "/trailing/object":
                        return new MockResponse().setResponseCode(200).setBody("{\"a\":1} not json");
                    case "/trailing/array":
                        return new MockResponse().setResponseCode(200).setBody("[1,2] <html>");
                    case "/trailing/number":
                        return new MockResponse().setResponseCode(200).setBody("42 oops");
                    case "/html":
                        return new MockResponse().setResponseCode(200).setBody("<html>not json</html>");
                    default:
                        if (path.startsWith("/status/")) {
                            return new MockResponse().setResponseCode(Integer.parseInt(path.substring("/status/".length())));
                        }
                        return new MockResponse().setResponseCode(404);
                }
            } catch (Exception e) {
                return new MockResponse().setResponseCode(400).setBody(String.valueOf(e.getMessage()));
            }
        }

        private MockResponse jsonResponse(Object body) throws Exception {
            return new MockResponse()
                    .setResponseCode(200)
                    .addHeader("Content-Type", "application/json")
                    .setBody(json.writeString(body));
        }
    }
}
