package com.finbrain.infrastructure.ai.brain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finbrain.domain.inference.model.InferenceMode;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpBrainTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private HttpBrainTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        BrainProperties properties = new BrainProperties();
        properties.setBaseUrl(server.url("/").toString());
        transport = new HttpBrainTransport(new OkHttpClient(), objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static BrainQuery query() {
        return new BrainQuery("STARBUCKS #1234", "parse", Map.of("monthly_income", 5000),
                List.of(Map.of("role", "user", "content", "hi")));
    }

    @Test
    @DisplayName("Posts the query envelope and reads the reply")
    void roundTrip() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"mode\":\"parse\",\"response\":\"ok\",\"parsed_data\":{\"merchant\":\"Starbucks\","
                        + "\"category\":\"coffee\"},\"confidence\":0.9,\"processing_time_ms\":42.5,\"extra\":true}"));

        BrainReply reply = transport.query(query(), TIMEOUT);

        assertThat(reply.confidence()).isEqualTo(0.9);
        assertThat(reply.processingTimeMs()).isEqualTo(42.5);
        assertThat(reply.payloadFor(InferenceMode.PARSE))
                .isEqualTo("[{\"label\":\"Starbucks\",\"category\":\"coffee\"}]");

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/query");
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertThat(body.get("mode").asText()).isEqualTo("parse");
        assertThat(body.get("context").get("monthly_income").asInt()).isEqualTo(5000);
        assertThat(body.get("conversation_history").get(0).get("role").asText()).isEqualTo("user");
    }

    @Test
    void serverErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> transport.query(query(), TIMEOUT))
                .isInstanceOf(TransientNetworkException.class)
                .extracting(e -> ((TransientNetworkException) e).getStatusCode())
                .isEqualTo(503);
    }

    @Test
    void tooManyRequestsIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThatThrownBy(() -> transport.query(query(), TIMEOUT))
                .isInstanceOf(TransientNetworkException.class);
    }

    @Test
    void clientErrorIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"detail\":\"bad mode\"}"));

        assertThatThrownBy(() -> transport.query(query(), TIMEOUT))
                .isInstanceOf(PermanentRemoteException.class);
    }

    @Test
    void unreadableEnvelopeIsPermanent() {
        server.enqueue(new MockResponse().setBody("<html>oops</html>"));

        assertThatThrownBy(() -> transport.query(query(), TIMEOUT))
                .isInstanceOf(PermanentRemoteException.class);
    }

    @Test
    void envelopeWithoutAnswerIsPermanent() {
        server.enqueue(new MockResponse().setBody("{\"mode\":\"chat\",\"confidence\":0.5}"));

        assertThatThrownBy(() -> transport.query(query(), TIMEOUT))
                .isInstanceOf(PermanentRemoteException.class);
    }

    @Test
    @DisplayName("A slow server exceeds the per-call timeout")
    void slowServerTimesOut() {
        server.enqueue(new MockResponse()
                .setBody("{\"mode\":\"chat\",\"response\":\"late\"}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        assertThatThrownBy(() -> transport.query(query(), Duration.ofMillis(200)))
                .isInstanceOf(TransientNetworkException.class);
    }

    @Test
    @DisplayName("A sub-millisecond budget still bounds the call")
    void subMillisecondTimeoutIsNotUnbounded() {
        server.enqueue(new MockResponse()
                .setBody("{\"mode\":\"chat\",\"response\":\"late\"}")
                .setHeadersDelay(1500, TimeUnit.MILLISECONDS));

        assertThatThrownBy(() -> transport.query(query(), Duration.ofNanos(500_000)))
                .isInstanceOf(TransientNetworkException.class);
    }

    @Test
    void callTimeoutNeverRoundsToZero() {
        assertThat(HttpBrainTransport.callTimeoutMillis(Duration.ofNanos(1))).isEqualTo(1L);
        assertThat(HttpBrainTransport.callTimeoutMillis(Duration.ZERO)).isEqualTo(1L);
        assertThat(HttpBrainTransport.callTimeoutMillis(Duration.ofMillis(-5))).isEqualTo(1L);
        assertThat(HttpBrainTransport.callTimeoutMillis(Duration.ofSeconds(2))).isEqualTo(2000L);
    }

    @Test
    void healthCheck() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\"}"));
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThat(transport.isHealthy(TIMEOUT)).isTrue();
        assertThat(transport.isHealthy(TIMEOUT)).isFalse();
        assertThat(server.takeRequest().getPath()).isEqualTo("/health");
    }
}
