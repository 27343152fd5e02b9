package com.acled.client.transport.apache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acled.client.transport.QueryParameter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApacheApiTransportTest {
    private MockWebServer server;
    private ApacheApiTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        transport = new ApacheApiTransport();
    }

    @AfterEach
    void tearDown() throws IOException {
        transport.close();
        server.shutdown();
    }

    @Test
    void getsEndpointWithOrderedParameters() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"success\":true,\"count\":0,\"data\":[]}"));

        byte[] body = transport.get(
                server.url("/").toString(),
                "acled",
                List.of(
                        QueryParameter.of("event_date_where", "BETWEEN"),
                        QueryParameter.of("event_date", "2024-01-01|2024-02-01"),
                        QueryParameter.of("country", "Burkina Faso"),
                        QueryParameter.of("key", "k"),
                        QueryParameter.of("email", "me@example.com")));

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("{\"success\":true,\"count\":0,\"data\":[]}");

        RecordedRequest request = server.takeRequest();
        HttpUrl url = request.getRequestUrl();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(url.encodedPath()).isEqualTo("/acled/read");
        assertThat(url.querySize()).isEqualTo(5);
        assertThat(url.queryParameterName(0)).isEqualTo("event_date_where");
        assertThat(url.queryParameterName(1)).isEqualTo("event_date");
        assertThat(url.queryParameterName(2)).isEqualTo("country");
        assertThat(url.queryParameter("event_date")).isEqualTo("2024-01-01|2024-02-01");
        assertThat(url.queryParameter("country")).isEqualTo("Burkina Faso");
        assertThat(url.queryParameter("email")).isEqualTo("me@example.com");
    }

    @Test
    void encodesComparisonSymbols() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));

        transport.get(
                server.url("/").toString(),
                "deleted",
                List.of(
                        QueryParameter.of("deleted_timestamp_where", ">="),
                        QueryParameter.of("deleted_timestamp", "1")));

        HttpUrl url = server.takeRequest().getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/deleted/read");
        assertThat(url.queryParameter("deleted_timestamp_where")).isEqualTo(">=");
    }

    @Test
    void nonSuccessStatusIsAnIOException() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("invalid key"));

        assertThatThrownBy(() -> transport.get(server.url("/").toString(), "acled", List.of()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 401")
                .hasMessageContaining("invalid key");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void serviceUnavailableIsNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));
        server.enqueue(new MockResponse().setBody("{}"));

        assertThatThrownBy(() -> transport.get(server.url("/").toString(), "acled", List.of()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 503");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }
}
