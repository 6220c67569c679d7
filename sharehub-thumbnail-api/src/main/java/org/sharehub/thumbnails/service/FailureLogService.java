package org.sharehub.thumbnails.service;

import org.sharehub.thumbnails.entity.ThumbnailFailureLog;
import org.sharehub.thumbnails.enums.FailureType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface FailureLogService {

    /**
     * Appends a failure entry. Never emits an error: a failing write is only logged.
     */
    Mono<Void> record(UUID tenantId, UUID eventId, UUID slideId, FailureType type, String message);

    Mono<Long> countSince(UUID eventId, OffsetDateTime since);

    /**
     * Failures recorded for the event over the trailing window.
     */
    Mono<Long> consecutiveFailureCount(UUID eventId);

    Flux<ThumbnailFailureLog> recentFailures(UUID eventId);

    boolean isNotificationThresholdReached(long failureCount);
}
