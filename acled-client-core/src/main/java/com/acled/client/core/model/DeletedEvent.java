package com.acled.client.core.model;

/**
 * An entry of the {@code deleted} endpoint.
 *
 * @param id identifier of the removed event ({@code event_id_cnty})
 * @param timestamp Unix timestamp (seconds) of the deletion ({@code deleted_timestamp})
 */
public record DeletedEvent(String id, long timestamp) {}
