package org.sharehub.thumbnails.dto.response;

import org.sharehub.thumbnails.entity.ThumbnailFailureLog;

import java.util.List;
import java.util.UUID;

/**
 * Escalation raised when an event accumulates too many thumbnail failures.
 */
public record FailureNotification(
        UUID tenantId,
        UUID eventId,
        long failureCount,
        List<ThumbnailFailureLog> recentFailures  // Most recent first, at most ten
) {
}
