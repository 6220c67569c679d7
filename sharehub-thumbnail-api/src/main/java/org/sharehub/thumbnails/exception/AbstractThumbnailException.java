package org.sharehub.thumbnails.exception;

public abstract class AbstractThumbnailException extends RuntimeException {

    public AbstractThumbnailException(String message) {
        super(message);
    }

    public AbstractThumbnailException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getError();

}
