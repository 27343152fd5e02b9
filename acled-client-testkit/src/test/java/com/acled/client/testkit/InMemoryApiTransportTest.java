package com.acled.client.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acled.client.transport.QueryParameter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryApiTransportTest {

    @Test
    void replaysResponsesInOrderAndRecordsRequests() throws IOException {
        InMemoryApiTransport transport = new InMemoryApiTransport().enqueue("first").enqueue("second");

        byte[] a = transport.get("http://h", "acled", List.of(QueryParameter.of("page", "1")));
        byte[] b = transport.get("http://h", "acled", List.of(QueryParameter.of("page", "2")));

        assertThat(new String(a, StandardCharsets.UTF_8)).isEqualTo("first");
        assertThat(new String(b, StandardCharsets.UTF_8)).isEqualTo("second");
        assertThat(transport.requests()).extracting(r -> r.parameter("page").orElseThrow()).containsExactly("1", "2");
        assertThat(transport.remaining()).isZero();
    }

    @Test
    void scriptedFailureIsThrown() {
        IOException boom = new IOException("boom");
        InMemoryApiTransport transport = new InMemoryApiTransport().enqueueFailure(boom);

        assertThatThrownBy(() -> transport.get("http://h", "deleted", List.of())).isSameAs(boom);
    }

    @Test
    void runningOutOfResponsesIsAnError() {
        InMemoryApiTransport transport = new InMemoryApiTransport();

        assertThatThrownBy(() -> transport.get("http://h", "acled", List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("#1");
    }
}
