package org.sharehub.thumbnails.dto.response;

import java.util.List;

/**
 * Summary of one retroactive thumbnail sweep.
 * Every eligible slide is counted in exactly one of processed, skipped, failed or quotaExhausted.
 */
public record RetroactiveSweepResult(
        int totalSlides,
        int processed,
        int skipped,
        int failed,
        int quotaExhausted,
        List<String> errors,
        long durationMs
) {
}
