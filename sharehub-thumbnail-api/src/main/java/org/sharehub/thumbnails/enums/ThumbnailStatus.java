package org.sharehub.thumbnails.enums;

public enum ThumbnailStatus {
    NONE,
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isInFlight() {
        return this == PENDING || this == PROCESSING;
    }
}
