package com.acled.client.core.endpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Wire shape of an {@code acled} record; every column arrives as a string and unmapped columns are skipped. */
@JsonIgnoreProperties(ignoreUnknown = true)
record AcledData(
        @JsonProperty("event_id_cnty") String eventIdCnty,
        @JsonProperty("event_date") String eventDate,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("disorder_type") String disorderType,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("sub_event_type") String subEventType,
        @JsonProperty("country") String country,
        @JsonProperty("region") String region,
        @JsonProperty("admin1") String admin1,
        @JsonProperty("latitude") String latitude,
        @JsonProperty("longitude") String longitude,
        @JsonProperty("notes") String notes) {}
