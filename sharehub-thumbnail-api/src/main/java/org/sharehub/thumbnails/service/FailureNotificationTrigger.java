package org.sharehub.thumbnails.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.dto.response.FailureNotification;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Escalates to a {@link FailureNotifier} once an event reaches the failure threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailureNotificationTrigger {

    private final FailureLogService failureLogService;
    private final FailureNotifier failureNotifier;

    /**
     * Emits true when a notification was handed to the notifier. Never emits an error.
     */
    public Mono<Boolean> evaluate(UUID tenantId, UUID eventId) {
        return failureLogService.consecutiveFailureCount(eventId)
                .flatMap(count -> {
                    if (!failureLogService.isNotificationThresholdReached(count)) {
                        log.debug("Event {} has {} recent thumbnail failures, below threshold", eventId, count);
                        return Mono.just(false);
                    }
                    return failureLogService.recentFailures(eventId)
                            .collectList()
                            .map(recent -> new FailureNotification(tenantId, eventId, count, recent))
                            .flatMap(failureNotifier::send)
                            .thenReturn(true);
                })
                .onErrorResume(e -> {
                    log.error("Failure notification evaluation failed for event {}", eventId, e);
                    return Mono.just(false);
                });
    }
}
