package com.acled.client.core.endpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Wire shape of a {@code deleted} record. */
@JsonIgnoreProperties(ignoreUnknown = true)
record DeletedData(
        @JsonProperty("event_id_cnty") String eventIdCnty,
        @JsonProperty("deleted_timestamp") String deletedTimestamp) {}
