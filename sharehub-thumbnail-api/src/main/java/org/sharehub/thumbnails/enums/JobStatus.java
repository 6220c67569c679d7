package org.sharehub.thumbnails.enums;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
