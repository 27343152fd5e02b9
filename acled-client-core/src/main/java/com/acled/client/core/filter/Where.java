package com.acled.client.core.filter;

import com.acled.client.transport.QueryParameter;
import java.util.List;
import java.util.Objects;

/**
 * Filter constraint for a single query field.
 * <p>
 * Every query field starts out {@link #unspecified()}, which leaves the field out of the request altogether.
 * {@link #matches(Object)} sends the bare value and lets the API apply whatever comparison it uses by default for
 * that field (usually {@code LIKE} or {@code =}); the remaining variants also send a {@code <field>_where} parameter
 * naming the {@link Comparison}.
 *
 * <pre>{@code
 * Where<Integer> since2022 = Where.greaterThanOrEqual(2022);
 * since2022.toParameters("year", ParameterFormat.INTEGER);
 * // [year_where=>=, year=2022]
 *
 * Where<LocalDate> february = Where.between(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));
 * february.toParameters("event_date", ParameterFormat.DATE);
 * // [event_date_where=BETWEEN, event_date=2024-02-01|2024-02-29]
 * }</pre>
 *
 * @param <T> operand type
 */
public sealed interface Where<T>
        permits Where.Unspecified,
                Where.Matches,
                Where.Equal,
                Where.Like,
                Where.GreaterThan,
                Where.GreaterThanOrEqual,
                Where.Between {

    /**
     * Encodes this constraint for {@code field}. The result depends only on the variant, its operands and the
     * field name.
     */
    List<QueryParameter> toParameters(String field, ParameterFormat<? super T> format);

    static <T> Where<T> unspecified() {
        return new Unspecified<>();
    }

    static <T> Where<T> matches(T value) {
        return new Matches<>(value);
    }

    static <T> Where<T> equal(T value) {
        return new Equal<>(value);
    }

    static <T> Where<T> like(T value) {
        return new Like<>(value);
    }

    static <T> Where<T> greaterThan(T value) {
        return new GreaterThan<>(value);
    }

    static <T> Where<T> greaterThanOrEqual(T value) {
        return new GreaterThanOrEqual<>(value);
    }

    static <T> Where<T> between(T from, T to) {
        return new Between<>(from, to);
    }

    record Unspecified<T>() implements Where<T> {
        @Override
        public List<QueryParameter> toParameters(String field, ParameterFormat<? super T> format) {
            return List.of();
        }
    }

    record Matches<T>(T value) implements Where<T> {
        public Matches {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public List<QueryParameter> toParameters(String field, ParameterFormat<? super T> format) {
            return List.of(QueryParameter.of(field, format.format(value)));
        }
    }

    record Equal<T>(T value) implements Where<T> {
        public Equal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public List<QueryParameter> toParameters(String field, ParameterFormat<? super T> format) {
            return Comparison.EQUAL.toParameters(field, format.format(value));
        }
    }

    record Like<T>(T value) implements Where<T> {
        public Like {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public List<QueryParameter> toParameters(String field, ParameterFormat<? super T> format) {
            return Comparison.LIKE.toParameters(field, format.format(value));
        }
    }

    record GreaterThan<T>(T value) implements Where<T> {
        public GreaterThan {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public List<QueryParameter> toParameters(String field, ParameterFormat<? super T> format) {
            return Comparison.GREATER_THAN.toParameters(field, format.format(value));
        }
    }

    record GreaterThanOrEqual<T>(T value) implements Where<T> {
        public GreaterThanOrEqual {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public List<QueryParameter> toParameters(String field, ParameterFormat<? super T> format) {
            return Comparison.GREATER_THAN_OR_EQUAL.toParameters(field, format.format(value));
        }
    }

    /** Inclusive range. */
    record Between<T>(T from, T to) implements Where<T> {
        public Between {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }

        @Override
        public List<QueryParameter> toParameters(String field, ParameterFormat<? super T> format) {
            String range = format.format(from) + Comparison.RANGE_SEPARATOR + format.format(to);
            return Comparison.BETWEEN.toParameters(field, range);
        }
    }
}
