package com.acled.client.core;

import com.acled.client.core.endpoint.Endpoint;
import com.acled.client.core.exception.AcledException;
import com.acled.client.core.model.AcledEvent;
import com.acled.client.core.model.DeletedEvent;
import com.acled.client.core.page.Paginator;
import com.acled.client.core.query.AcledQuery;
import com.acled.client.core.query.DeletedQuery;
import com.acled.client.core.response.ResponseEnvelopeDecoder;
import com.acled.client.transport.ApiTransport;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for the ACLED endpoints. Every call follows pagination to the end and returns all matching records,
 * or throws without returning any.
 *
 * <pre>{@code
 * var configuration = AcledConfiguration.of(new Credentials("XXXXX", "foo@example.com"));
 * try (var api = new AcledApi(configuration, new JdkHttpApiTransport())) {
 *     List<AcledEvent> events = api.getAcled(AcledQuery.builder()
 *             .country(Where.matches("Afghanistan"))
 *             .year(Where.greaterThanOrEqual(2022))
 *             .build());
 * }
 * }</pre>
 *
 * @see <a href="https://apidocs.acleddata.com/">ACLED API documentation</a>
 */
public final class AcledApi implements AutoCloseable {
    private final ApiTransport transport;
    private final Paginator paginator;

    public AcledApi(AcledConfiguration configuration, ApiTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.paginator = new Paginator(transport, configuration, new ResponseEnvelopeDecoder());
    }

    /** Events of the {@code acled} endpoint. */
    public List<AcledEvent> getAcled(AcledQuery query) throws AcledException {
        return paginator.fetchAll(Endpoint.ACLED, query.toParameters());
    }

    /** Entries of the {@code deleted} endpoint. */
    public List<DeletedEvent> getDeleted(DeletedQuery query) throws AcledException {
        return paginator.fetchAll(Endpoint.DELETED, query.toParameters());
    }

    @Override
    public void close() throws IOException {
        transport.close();
    }
}
