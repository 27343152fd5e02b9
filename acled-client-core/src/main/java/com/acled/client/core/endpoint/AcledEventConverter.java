package com.acled.client.core.endpoint;

import com.acled.client.core.exception.FieldParseException;
import com.acled.client.core.model.AcledEvent;
import com.acled.client.core.model.EventType;
import com.acled.client.core.model.Region;
import com.acled.client.core.response.RecordConverter;
import java.time.LocalDate;

/**
 * Columns are read in wire order: {@code event_id_cnty}, {@code event_date}, {@code timestamp}, {@code disorder_type},
 * {@code event_type}, {@code sub_event_type}, {@code country}, {@code region}, {@code admin1}, {@code latitude},
 * {@code longitude}, {@code notes}.
 */
final class AcledEventConverter implements RecordConverter<AcledData, AcledEvent> {

    @Override
    public AcledEvent convert(AcledData raw) throws FieldParseException {
        String id = FieldParsers.text("event_id_cnty", raw.eventIdCnty());
        LocalDate date = FieldParsers.date("event_date", raw.eventDate());
        long timestamp = FieldParsers.unsignedLong("timestamp", raw.timestamp());
        String disorderType = FieldParsers.text("disorder_type", raw.disorderType());
        String type = FieldParsers.text("event_type", raw.eventType());
        String subType = FieldParsers.text("sub_event_type", raw.subEventType());
        String country = FieldParsers.text("country", raw.country());
        Region region = FieldParsers.region("region", raw.region());
        String admin1 = FieldParsers.text("admin1", raw.admin1());
        double latitude = FieldParsers.decimal("latitude", raw.latitude());
        double longitude = FieldParsers.decimal("longitude", raw.longitude());
        String notes = FieldParsers.text("notes", raw.notes());
        return new AcledEvent(
                id,
                timestamp,
                date,
                new EventType(type, subType),
                disorderType,
                region,
                country,
                admin1,
                latitude,
                longitude,
                notes);
    }
}
