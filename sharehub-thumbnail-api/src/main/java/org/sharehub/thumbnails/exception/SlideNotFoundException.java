package org.sharehub.thumbnails.exception;

import java.util.UUID;

public class SlideNotFoundException extends AbstractThumbnailException {

    public SlideNotFoundException(UUID slideId) {
        super("Slide not found : " + slideId);
    }

    @Override
    public String getError() {
        return ThumbnailException.SLIDE_NOT_FOUND;
    }
}
