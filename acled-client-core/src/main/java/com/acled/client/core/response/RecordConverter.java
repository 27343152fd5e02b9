package com.acled.client.core.response;

import com.acled.client.core.exception.FieldParseException;

/**
 * Converts one loosely typed raw record into its public typed counterpart.
 * Implementations parse fields in a fixed order and stop at the first field that fails.
 */
@FunctionalInterface
public interface RecordConverter<R, T> {

    T convert(R raw) throws FieldParseException;
}
