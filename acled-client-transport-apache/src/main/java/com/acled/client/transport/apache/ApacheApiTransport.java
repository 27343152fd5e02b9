package com.acled.client.transport.apache;

import com.acled.client.transport.ApiTransport;
import com.acled.client.transport.QueryParameter;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Apache HttpClient 5 transport. */
public class ApacheApiTransport implements ApiTransport {
    private static final Logger log = LoggerFactory.getLogger(ApacheApiTransport.class);

    private final CloseableHttpClient client;

    /** Default client with automatic retries disabled; a failed page fails the fetch. */
    public ApacheApiTransport() {
        this(HttpClients.custom().disableAutomaticRetries().build());
    }

    public ApacheApiTransport(CloseableHttpClient client) {
        this.client = client;
    }

    @Override
    public byte[] get(String baseUrl, String endpoint, List<QueryParameter> parameters) throws IOException {
        URI uri = ApiTransport.buildUri(baseUrl, endpoint, parameters);
        HttpGet get = new HttpGet(uri);
        get.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
        log.debug("GET {} {}", uri.getPath(), ApiTransport.describe(parameters));
        return client.execute(get, response -> {
            byte[] body = response.getEntity() != null ? EntityUtils.toByteArray(response.getEntity()) : new byte[0];
            int status = response.getCode();
            if (status < 200 || status >= 300) {
                String text = new String(body, StandardCharsets.UTF_8);
                log.warn("GET {} failed with status {} and body: {}", uri.getPath(), status, text);
                throw new IOException("HTTP " + status + " - " + text);
            }
            return body;
        });
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
