package org.sharehub.thumbnails.enums;

/**
 * Outcome of a single thumbnail submission attempt.
 */
public enum GenerationStatus {
    PROCESSING,
    COMPLETED,
    FAILED,
    QUOTA_EXHAUSTED,
    DISABLED
}
