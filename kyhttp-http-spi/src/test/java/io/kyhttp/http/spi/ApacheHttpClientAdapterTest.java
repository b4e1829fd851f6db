package io.kyhttp.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ApacheHttpClientAdapterTest {

    private MockWebServer server;
    private ApacheHttpClientAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = ApacheHttpClientAdapter.create();
    }

    @AfterEach
    void tearDown() throws Exception {
        adapter.close();
        server.shutdown();
    }

    @Test
    void sendAndSendAsyncReturnResponses() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).addHeader("X-A", "1").addHeader("X-A", "2").setBody("first"));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("second"));

        HttpClientResponse first = adapter.send(HttpClientRequest.get(server.url("/one").uri()).build());
        HttpClientResponse second = adapter.sendAsync(HttpClientRequest.get(server.url("/two").uri()).build())
                .get(5, TimeUnit.SECONDS);

        assertThat(first.statusCode()).isEqualTo(200);
        assertThat(first.headers().get("X-A")).containsExactly("1", "2");
        assertThat(new String(first.body(), StandardCharsets.UTF_8)).isEqualTo("first");
        assertThat(second.statusCode()).isEqualTo(500);
        assertThat(new String(second.body(), StandardCharsets.UTF_8)).isEqualTo("second");
    }

    @Test
    void lowerCaseContentTypeSetsEntityType() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        adapter.send(HttpClientRequest.builder(server.url("/post").uri(), "POST")
                .header("content-type", "application/json")
                .body("{}".getBytes(StandardCharsets.UTF_8))
                .build());

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{}");
    }
}
