package org.sharehub.thumbnails.exception;

import java.util.UUID;

public class EventNotFoundException extends AbstractThumbnailException {

    public EventNotFoundException(UUID eventId) {
        super("Event not found : " + eventId);
    }

    @Override
    public String getError() {
        return ThumbnailException.EVENT_NOT_FOUND;
    }
}
