package com.acled.client.transport.okhttp;

import com.acled.client.transport.ApiTransport;
import com.acled.client.transport.QueryParameter;
import java.io.IOException;
import java.net.Inet4Address;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import okhttp3.Dns;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based transport. */
public class OkHttpApiTransport implements ApiTransport {
    private static final Logger log = LoggerFactory.getLogger(OkHttpApiTransport.class);
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private final OkHttpClient client;

    public OkHttpApiTransport() {
        this(new OkHttpClient.Builder().dns(PREFER_IPV4_DNS).build());
    }

    public OkHttpApiTransport(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public byte[] get(String baseUrl, String endpoint, List<QueryParameter> parameters) throws IOException {
        HttpUrl url = url(baseUrl, endpoint, parameters);
        Request req = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .get()
                .build();
        log.debug("{} {} {}", req.method(), url.encodedPath(), ApiTransport.describe(parameters));
        try (Response r = client.newCall(req).execute()) {
            ResponseBody body = r.body();
            byte[] bytes = body != null ? body.bytes() : new byte[0];
            if (!r.isSuccessful()) {
                String text = new String(bytes, StandardCharsets.UTF_8);
                log.warn("{} {} failed with status {} and body: {}", req.method(), url.encodedPath(), r.code(), text);
                throw new IOException("HTTP " + r.code() + " - " + text);
            }
            return bytes;
        }
    }

    static HttpUrl url(String baseUrl, String endpoint, List<QueryParameter> parameters) {
        HttpUrl parsed = HttpUrl.parse(ApiTransport.endpointUrl(baseUrl, endpoint));
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid base URL: " + baseUrl);
        }
        HttpUrl.Builder builder = parsed.newBuilder();
        for (QueryParameter p : parameters) {
            builder.addQueryParameter(p.name(), p.value());
        }
        return builder.build();
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
