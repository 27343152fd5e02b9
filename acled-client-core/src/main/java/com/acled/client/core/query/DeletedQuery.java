package com.acled.client.core.query;

import com.acled.client.core.filter.ParameterFormat;
import com.acled.client.core.filter.Where;
import com.acled.client.transport.QueryParameter;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Filters for the {@code deleted} endpoint, emitted in the order {@code event_id_cnty}, {@code deleted_timestamp}.
 *
 * <pre>{@code
 * DeletedQuery query = DeletedQuery.builder()
 *         .timestamp(Where.greaterThanOrEqual(1710025200L))
 *         .build();
 * }</pre>
 */
@Getter
@Builder(toBuilder = true)
public final class DeletedQuery {
    public static final String ID = "event_id_cnty";
    public static final String TIMESTAMP = "deleted_timestamp";

    @NonNull
    @Builder.Default
    private final Where<String> id = Where.unspecified();

    @NonNull
    @Builder.Default
    private final Where<Long> timestamp = Where.unspecified();

    public static DeletedQuery all() {
        return builder().build();
    }

    public List<QueryParameter> toParameters() {
        List<QueryParameter> parameters = new ArrayList<>();
        parameters.addAll(id.toParameters(ID, ParameterFormat.STRING));
        parameters.addAll(timestamp.toParameters(TIMESTAMP, ParameterFormat.LONG));
        return List.copyOf(parameters);
    }
}
