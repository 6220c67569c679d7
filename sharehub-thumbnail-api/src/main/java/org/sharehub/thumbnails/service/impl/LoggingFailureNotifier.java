package org.sharehub.thumbnails.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.dto.response.FailureNotification;
import org.sharehub.thumbnails.entity.ThumbnailFailureLog;
import org.sharehub.thumbnails.service.FailureNotifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Default notifier: writes the escalation to the log, where operational alerting picks it up.
 * Set sharehub.thumbnail.failure.notifier to another value to plug a different FailureNotifier.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "sharehub.thumbnail.failure.notifier", havingValue = "log", matchIfMissing = true)
public class LoggingFailureNotifier implements FailureNotifier {

    @Override
    public Mono<Void> send(FailureNotification notification) {
        return Mono.fromRunnable(() -> {
            log.warn("Thumbnail generation failing for event {} of tenant {}: {} failures in the last window",
                    notification.eventId(), notification.tenantId(), notification.failureCount());
            for (ThumbnailFailureLog failure : notification.recentFailures()) {
                log.warn("  slide {} at {}: [{}] {}", failure.getSlideId(), failure.getOccurredAt(),
                        failure.getErrorType(), failure.getErrorMessage());
            }
        });
    }
}
