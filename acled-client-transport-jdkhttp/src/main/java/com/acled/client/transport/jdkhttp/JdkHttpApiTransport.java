package com.acled.client.transport.jdkhttp;

import com.acled.client.transport.ApiTransport;
import com.acled.client.transport.QueryParameter;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** JDK11+ HttpClient transport (zero external deps). */
public class JdkHttpApiTransport implements ApiTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpApiTransport.class);

    private final HttpClient client;

    public JdkHttpApiTransport() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public JdkHttpApiTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public byte[] get(String baseUrl, String endpoint, List<QueryParameter> parameters) throws IOException {
        URI uri = ApiTransport.buildUri(baseUrl, endpoint, parameters);
        HttpRequest req = HttpRequest.newBuilder(uri)
                .header("Accept", "application/json")
                .GET()
                .build();
        log.debug("GET {} {}", uri.getPath(), ApiTransport.describe(parameters));
        try {
            HttpResponse<byte[]> resp = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                String body = new String(resp.body(), StandardCharsets.UTF_8);
                log.warn("GET {} failed with status {} and body: {}", uri.getPath(), resp.statusCode(), body);
                throw new IOException("HTTP " + resp.statusCode() + " - " + body);
            }
            return resp.body();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", ie);
        }
    }
}
