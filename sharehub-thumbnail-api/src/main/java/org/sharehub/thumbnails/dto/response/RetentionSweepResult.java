package org.sharehub.thumbnails.dto.response;

import java.time.OffsetDateTime;
import java.util.List;

public record RetentionSweepResult(
        int deletedCount,
        int processedCount,
        List<RetentionError> errors,
        long executionTimeMs,
        OffsetDateTime nextRun
) {
}
