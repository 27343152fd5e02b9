package com.acled.client.core.query;

import com.acled.client.core.filter.ParameterFormat;
import com.acled.client.core.filter.Where;
import com.acled.client.core.model.Region;
import com.acled.client.transport.QueryParameter;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Filters for the {@code acled} endpoint. Every field is optional and defaults to {@link Where#unspecified()}.
 *
 * <pre>{@code
 * // all events from Afghanistan since 2022
 * AcledQuery query = AcledQuery.builder()
 *         .country(Where.matches("Afghanistan"))
 *         .year(Where.greaterThanOrEqual(2022))
 *         .build();
 * }</pre>
 *
 * Parameters are emitted in the order {@code country}, {@code event_id_cnty}, {@code year}, {@code region},
 * {@code event_date}, {@code timestamp}.
 *
 * @see <a href="https://apidocs.acleddata.com/acled_endpoint.html#query-filters">Query filters</a>
 */
@Getter
@Builder(toBuilder = true)
public final class AcledQuery {
    public static final String COUNTRY = "country";
    public static final String ID = "event_id_cnty";
    public static final String YEAR = "year";
    public static final String REGION = "region";
    public static final String DATE = "event_date";
    public static final String TIMESTAMP = "timestamp";

    @NonNull
    @Builder.Default
    private final Where<String> country = Where.unspecified();

    @NonNull
    @Builder.Default
    private final Where<String> id = Where.unspecified();

    @NonNull
    @Builder.Default
    private final Where<Integer> year = Where.unspecified();

    @NonNull
    @Builder.Default
    private final Where<Region> region = Where.unspecified();

    @NonNull
    @Builder.Default
    private final Where<LocalDate> date = Where.unspecified();

    @NonNull
    @Builder.Default
    private final Where<Long> timestamp = Where.unspecified();

    /** Query without any filter. */
    public static AcledQuery all() {
        return builder().build();
    }

    public List<QueryParameter> toParameters() {
        List<QueryParameter> parameters = new ArrayList<>();
        parameters.addAll(country.toParameters(COUNTRY, ParameterFormat.STRING));
        parameters.addAll(id.toParameters(ID, ParameterFormat.STRING));
        parameters.addAll(year.toParameters(YEAR, ParameterFormat.INTEGER));
        parameters.addAll(region.toParameters(REGION, ParameterFormat.code()));
        parameters.addAll(date.toParameters(DATE, ParameterFormat.DATE));
        parameters.addAll(timestamp.toParameters(TIMESTAMP, ParameterFormat.LONG));
        return List.copyOf(parameters);
    }
}
