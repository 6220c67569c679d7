package org.sharehub.thumbnails.enums;

/**
 * Categories written to the thumbnail failure log.
 */
public enum FailureType {
    /**
     * The conversion job could not be created.
     */
    EXTERNAL_SUBMISSION_ERROR,
    /**
     * The conversion service reported the job as failed.
     */
    EXTERNAL_CONVERSION_ERROR,
    /**
     * The converted image could not be fetched or stored.
     */
    THUMBNAIL_STORAGE_ERROR
}
