package org.sharehub.thumbnails.exception;

import java.util.UUID;

public class ThumbnailRetryConflictException extends AbstractThumbnailException {

    public ThumbnailRetryConflictException(UUID slideId) {
        super("A thumbnail job is already in progress for slide " + slideId);
    }

    @Override
    public String getError() {
        return ThumbnailException.RETRY_CONFLICT;
    }
}
