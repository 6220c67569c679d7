package org.sharehub.thumbnails.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.ThumbnailProperties;
import org.sharehub.thumbnails.entity.ThumbnailFailureLog;
import org.sharehub.thumbnails.enums.FailureType;
import org.sharehub.thumbnails.repository.FailureLogRepository;
import org.sharehub.thumbnails.service.FailureLogService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class FailureLogServiceImpl implements FailureLogService {

    private final FailureLogRepository failureLogRepository;
    private final ThumbnailProperties thumbnailProperties;
    private final Clock clock;

    @Override
    public Mono<Void> record(UUID tenantId, UUID eventId, UUID slideId, FailureType type, String message) {
        ThumbnailFailureLog entry = ThumbnailFailureLog.builder()
                .tenantId(tenantId)
                .eventId(eventId)
                .slideId(slideId)
                .errorType(type)
                .errorMessage(message == null ? "Unknown error" : message)
                .occurredAt(OffsetDateTime.now(clock))
                .build();
        return failureLogRepository.save(entry)
                .doOnNext(saved -> log.debug("Recorded {} for slide {}", type, slideId))
                .onErrorResume(e -> {
                    log.error("Failed to record {} for slide {} (event {})", type, slideId, eventId, e);
                    return Mono.empty();
                })
                .then();
    }

    @Override
    public Mono<Long> countSince(UUID eventId, OffsetDateTime since) {
        return failureLogRepository.countByEventIdAndOccurredAtGreaterThanEqual(eventId, since)
                .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Long> consecutiveFailureCount(UUID eventId) {
        return countSince(eventId, windowStart());
    }

    @Override
    public Flux<ThumbnailFailureLog> recentFailures(UUID eventId) {
        return failureLogRepository.findTop10ByEventIdAndOccurredAtGreaterThanEqualOrderByOccurredAtDesc(eventId, windowStart());
    }

    @Override
    public boolean isNotificationThresholdReached(long failureCount) {
        return failureCount >= thumbnailProperties.getFailure().getNotificationThreshold();
    }

    private OffsetDateTime windowStart() {
        return OffsetDateTime.now(clock).minus(thumbnailProperties.failureWindow());
    }
}
