package com.acled.client.core.filter;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Renders a filter operand of type {@code T} as query-string text.
 * <p>
 * Query builders pair every field with the format of its operand type, so encoding never inspects runtime types.
 */
@FunctionalInterface
public interface ParameterFormat<T> {
    ParameterFormat<String> STRING = value -> value;
    ParameterFormat<Integer> INTEGER = value -> Integer.toString(value);
    ParameterFormat<Long> LONG = value -> Long.toString(value);
    /** {@code YYYY-MM-DD}. */
    ParameterFormat<LocalDate> DATE = DateTimeFormatter.ISO_LOCAL_DATE::format;

    String format(T value);

    /** Format for types that render themselves, such as {@link com.acled.client.core.model.Region}. */
    static <T extends ParameterValue> ParameterFormat<T> code() {
        return ParameterValue::asParameter;
    }
}
