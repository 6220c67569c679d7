package org.sharehub.thumbnails.exception;

public class StorageException extends AbstractThumbnailException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return ThumbnailException.STORAGE;
    }
}
