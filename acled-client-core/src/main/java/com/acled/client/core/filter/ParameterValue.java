package com.acled.client.core.filter;

/** A value type that knows its own query-string rendering, e.g. an enumerated code sent as its number. */
public interface ParameterValue {

    String asParameter();
}
