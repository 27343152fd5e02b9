package com.acled.client.core.endpoint;

import com.acled.client.core.exception.FieldParseException;
import com.acled.client.core.model.DeletedEvent;
import com.acled.client.core.response.RecordConverter;

final class DeletedEventConverter implements RecordConverter<DeletedData, DeletedEvent> {

    @Override
    public DeletedEvent convert(DeletedData raw) throws FieldParseException {
        String id = FieldParsers.text("event_id_cnty", raw.eventIdCnty());
        long timestamp = FieldParsers.unsignedLong("deleted_timestamp", raw.deletedTimestamp());
        return new DeletedEvent(id, timestamp);
    }
}
