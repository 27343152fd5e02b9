package com.acled.client.transport;

import java.util.Objects;

/** One {@code name=value} pair of a request query string. Order of parameters is significant. */
public record QueryParameter(String name, String value) {

    public QueryParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public static QueryParameter of(String name, String value) {
        return new QueryParameter(name, value);
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
