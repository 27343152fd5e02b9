package com.acled.client.testkit;

import com.acled.client.transport.ApiTransport;
import com.acled.client.transport.QueryParameter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/** Test double that replays scripted response bodies in order and records every request. */
public class InMemoryApiTransport implements ApiTransport {
    private final Deque<Object> responses = new ArrayDeque<>();
    private final List<RecordedRequest> requests = new ArrayList<>();
    private boolean closed;

    public InMemoryApiTransport enqueue(String body) {
        responses.add(body.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public InMemoryApiTransport enqueueFailure(IOException failure) {
        responses.add(failure);
        return this;
    }

    @Override
    public byte[] get(String baseUrl, String endpoint, List<QueryParameter> parameters) throws IOException {
        requests.add(new RecordedRequest(baseUrl, endpoint, List.copyOf(parameters)));
        Object next = responses.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted response left for request #" + requests.size());
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        return (byte[]) next;
    }

    public List<RecordedRequest> requests() {
        return Collections.unmodifiableList(requests);
    }

    public int remaining() {
        return responses.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    public record RecordedRequest(String baseUrl, String endpoint, List<QueryParameter> parameters) {

        public Optional<String> parameter(String name) {
            return parameters.stream()
                    .filter(p -> p.name().equals(name))
                    .map(QueryParameter::value)
                    .findFirst();
        }
    }
}
