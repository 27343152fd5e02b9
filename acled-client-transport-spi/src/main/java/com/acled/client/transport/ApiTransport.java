package com.acled.client.transport;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Minimal transport SPI: issue a blocking {@code GET} against an API endpoint and hand back the raw JSON body.
 * <p>
 * Implementations must preserve the order of {@code parameters}, URL-encode names and values, and report any
 * non-2xx status as an {@link IOException}. Nothing is retried.
 */
public interface ApiTransport extends Closeable {
    String READ_SUFFIX = "/read";

    byte[] get(String baseUrl, String endpoint, List<QueryParameter> parameters) throws IOException;

    @Override
    default void close() throws IOException {
        /* no-op */
    }

    /** {@code https://host} + {@code acled} becomes {@code https://host/acled/read}. */
    static String endpointUrl(String baseUrl, String endpoint) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(endpoint, "endpoint");
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
        return base + "/" + path + READ_SUFFIX;
    }

    static URI buildUri(String baseUrl, String endpoint, List<QueryParameter> parameters) {
        StringBuilder sb = new StringBuilder(endpointUrl(baseUrl, endpoint));
        boolean first = true;
        for (QueryParameter p : parameters) {
            sb.append(first ? '?' : '&');
            first = false;
            sb.append(encode(p.name())).append('=').append(encode(p.value()));
        }
        return URI.create(sb.toString());
    }

    /** Parameter list with credential values masked, for log output. */
    static String describe(List<QueryParameter> parameters) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < parameters.size(); i++) {
            QueryParameter p = parameters.get(i);
            if (i > 0) sb.append(", ");
            sb.append(p.name()).append('=');
            sb.append(isSecret(p.name()) ? "***" : p.value());
        }
        return sb.append(']').toString();
    }

    private static boolean isSecret(String name) {
        return "key".equals(name) || "email".equals(name);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
