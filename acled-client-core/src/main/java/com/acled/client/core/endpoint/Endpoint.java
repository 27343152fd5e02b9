package com.acled.client.core.endpoint;

import com.acled.client.core.model.AcledEvent;
import com.acled.client.core.model.DeletedEvent;
import com.acled.client.core.response.RecordConverter;
import java.util.Objects;

/**
 * A readable API endpoint: its path segment, the wire record type and the conversion to the public record type.
 *
 * @param name path segment, requested as {@code /<name>/read}
 */
public record Endpoint<R, T>(String name, Class<R> rawType, RecordConverter<R, T> converter) {

    public static final Endpoint<?, AcledEvent> ACLED =
            new Endpoint<>("acled", AcledData.class, new AcledEventConverter());
    public static final Endpoint<?, DeletedEvent> DELETED =
            new Endpoint<>("deleted", DeletedData.class, new DeletedEventConverter());

    public Endpoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rawType, "rawType");
        Objects.requireNonNull(converter, "converter");
    }
}
