package com.acled.client.core.model;

import java.time.LocalDate;

/**
 * An event returned by the {@code acled} endpoint.
 *
 * @param id unique identifier by number and country acronym ({@code event_id_cnty}); stays constant when the event
 *     details are updated
 * @param timestamp Unix timestamp (seconds) of the last upload of this event to the API
 * @param date day on which the event took place ({@code event_date})
 * @param eventType {@code event_type} and {@code sub_event_type}
 * @param disorderType disorder category the event belongs to
 * @param region region of the world where the event took place
 * @param country country or territory in which the event took place
 * @param administrativeRegion largest sub-national administrative region ({@code admin1})
 * @param latitude WGS84 latitude
 * @param longitude WGS84 longitude
 * @param note short description of the event ({@code notes})
 * @see <a href="https://apidocs.acleddata.com/acled_endpoint.html">acled endpoint</a>
 */
public record AcledEvent(
        String id,
        long timestamp,
        LocalDate date,
        EventType eventType,
        String disorderType,
        Region region,
        String country,
        String administrativeRegion,
        double latitude,
        double longitude,
        String note) {}
