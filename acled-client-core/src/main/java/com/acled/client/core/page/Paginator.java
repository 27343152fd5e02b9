package com.acled.client.core.page;

import com.acled.client.core.AcledConfiguration;
import com.acled.client.core.endpoint.Endpoint;
import com.acled.client.core.exception.AcledException;
import com.acled.client.core.exception.TransportException;
import com.acled.client.core.response.ResponseEnvelopeDecoder;
import com.acled.client.transport.ApiTransport;
import com.acled.client.transport.QueryParameter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches every page of an endpoint, one blocking request at a time.
 * <p>
 * The API never says whether more pages exist. A page holding fewer rows than {@link AcledConfiguration#pageSize()}
 * (an empty one included) is taken as the last; a full page means another request. The same page size is sent as
 * {@code limit} whenever it differs from the API default, so the requested and the expected page size cannot drift
 * apart.
 * <p>
 * Each call owns its page counter and accumulator. Any failure ends the fetch and no partial result is returned.
 */
@Slf4j
public final class Paginator {
    public static final String KEY = "key";
    public static final String EMAIL = "email";
    public static final String LIMIT = "limit";
    public static final String PAGE = "page";

    private final ApiTransport transport;
    private final AcledConfiguration configuration;
    private final ResponseEnvelopeDecoder decoder;

    public Paginator(ApiTransport transport, AcledConfiguration configuration, ResponseEnvelopeDecoder decoder) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    public <T> List<T> fetchAll(Endpoint<?, T> endpoint, List<QueryParameter> query) throws AcledException {
        List<T> all = new ArrayList<>();
        int pageSize = configuration.pageSize();
        for (int page = 1; ; page++) {
            List<T> records = fetchPage(endpoint, query, page);
            all.addAll(records);
            log.debug("{} page {} returned {} records ({} total)", endpoint.name(), page, records.size(), all.size());
            if (records.size() < pageSize) {
                return Collections.unmodifiableList(all);
            }
        }
    }

    private <R, T> List<T> fetchPage(Endpoint<R, T> endpoint, List<QueryParameter> query, int page)
            throws AcledException {
        List<QueryParameter> parameters = requestParameters(query, page);
        byte[] body;
        try {
            body = transport.get(configuration.baseUrl(), endpoint.name(), parameters);
        } catch (IOException e) {
            throw new TransportException("Request for " + endpoint.name() + " page " + page + " failed", e);
        }
        return decoder.decode(body, endpoint.rawType(), endpoint.converter());
    }

    /** Query filters, then credentials, then {@code limit} and {@code page} where needed. */
    List<QueryParameter> requestParameters(List<QueryParameter> query, int page) {
        List<QueryParameter> parameters = new ArrayList<>(query.size() + 4);
        parameters.addAll(query);
        parameters.add(QueryParameter.of(KEY, configuration.credentials().key()));
        parameters.add(QueryParameter.of(EMAIL, configuration.credentials().email()));
        if (configuration.customPageSize()) {
            parameters.add(QueryParameter.of(LIMIT, Integer.toString(configuration.pageSize())));
        }
        if (page > 1) {
            parameters.add(QueryParameter.of(PAGE, Integer.toString(page)));
        }
        return parameters;
    }
}
