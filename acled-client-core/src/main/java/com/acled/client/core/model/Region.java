package com.acled.client.core.model;

import com.acled.client.core.filter.ParameterValue;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * World regions used by ACLED. Queries send the numeric code, responses carry the display name.
 *
 * @see <a href="https://apidocs.acleddata.com/acled_endpoint.html#regions">Regions</a>
 */
public enum Region implements ParameterValue {
    WESTERN_AFRICA(1, "Western Africa"),
    MIDDLE_AFRICA(2, "Middle Africa"),
    EASTERN_AFRICA(3, "Eastern Africa"),
    SOUTHERN_AFRICA(4, "Southern Africa"),
    NORTHERN_AFRICA(5, "Northern Africa"),
    SOUTH_ASIA(7, "South Asia"),
    SOUTHEAST_ASIA(9, "Southeast Asia"),
    MIDDLE_EAST(11, "Middle East"),
    EUROPE(12, "Europe"),
    CAUCASUS_AND_CENTRAL_ASIA(13, "Caucasus and Central Asia"),
    CENTRAL_AMERICA(14, "Central America"),
    SOUTH_AMERICA(15, "South America"),
    CARIBBEAN(16, "Caribbean"),
    EAST_ASIA(17, "East Asia"),
    NORTH_AMERICA(18, "North America"),
    OCEANIA(19, "Oceania"),
    ANTARCTICA(20, "Antarctica");

    private static final Map<String, Region> BY_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Region::displayName, Function.identity()));
    private static final Map<Integer, Region> BY_CODE =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Region::code, Function.identity()));

    private final int code;
    private final String displayName;

    Region(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /** Exact, case-sensitive match on the display name as the API returns it. */
    public static Optional<Region> fromName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name));
    }

    public static Optional<Region> fromCode(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    @Override
    public String asParameter() {
        return Integer.toString(code);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
