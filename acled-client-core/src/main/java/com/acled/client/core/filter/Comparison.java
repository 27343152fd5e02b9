package com.acled.client.core.filter;

import com.acled.client.transport.QueryParameter;
import java.util.List;

/**
 * Explicit query types understood by the API, sent as {@code <field>_where=<symbol>}.
 *
 * <ul>
 *     <li>EQUAL / =</li>
 *     <li>LIKE / LIKE (use {@code *} as wildcard)</li>
 *     <li>GREATER_THAN / &gt;</li>
 *     <li>GREATER_THAN_OR_EQUAL / &gt;= (accepted by the API, not listed in its documentation)</li>
 *     <li>BETWEEN / BETWEEN (inclusive, operands joined by {@code |})</li>
 * </ul>
 *
 * @see <a href="https://apidocs.acleddata.com/generalities_section.html#query-types">Query types</a>
 */
public enum Comparison {
    EQUAL("="),
    LIKE("LIKE"),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    BETWEEN("BETWEEN");

    public static final String WHERE_SUFFIX = "_where";
    public static final String RANGE_SEPARATOR = "|";

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Operator pair first, value pair second. */
    List<QueryParameter> toParameters(String field, String value) {
        return List.of(QueryParameter.of(field + WHERE_SUFFIX, symbol), QueryParameter.of(field, value));
    }
}
