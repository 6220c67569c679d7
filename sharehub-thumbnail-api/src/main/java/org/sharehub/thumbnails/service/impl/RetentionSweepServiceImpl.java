package org.sharehub.thumbnails.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.RetentionProperties;
import org.sharehub.thumbnails.dto.response.RetentionError;
import org.sharehub.thumbnails.dto.response.RetentionSweepResult;
import org.sharehub.thumbnails.entity.Slide;
import org.sharehub.thumbnails.repository.SlideDAO;
import org.sharehub.thumbnails.service.ObjectStorageService;
import org.sharehub.thumbnails.service.RetentionSweepService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionSweepServiceImpl implements RetentionSweepService {

    private static final int DELETE_CONCURRENCY = 8;

    private final SlideDAO slideDAO;
    private final ObjectStorageService objectStorageService;
    private final RetentionProperties retentionProperties;
    private final Clock clock;

    @Override
    public Mono<RetentionSweepResult> run() {
        long start = clock.millis();
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime cutoff = now.minusHours(retentionProperties.getRetentionHours());
        log.info("Starting retention sweep for slides uploaded before {}", cutoff);

        return slideDAO.findExpired(cutoff, retentionProperties.getBatchSize())
                .flatMap(this::purge, DELETE_CONCURRENCY)
                .collectList()
                .map(outcomes -> {
                    int deleted = (int) outcomes.stream().filter(Outcome::deleted).count();
                    List<RetentionError> errors = outcomes.stream()
                            .map(Outcome::error)
                            .filter(Objects::nonNull)
                            .toList();
                    return new RetentionSweepResult(deleted, outcomes.size(), errors,
                            clock.millis() - start, now.plusHours(retentionProperties.getIntervalHours()));
                })
                .doOnNext(result -> log.info("Retention sweep completed: {} of {} slides deleted, {} errors, {}ms",
                        result.deletedCount(), result.processedCount(), result.errors().size(), result.executionTimeMs()))
                .onErrorResume(e -> {
                    log.error("Retention sweep aborted", e);
                    return Mono.just(new RetentionSweepResult(0, 0,
                            List.of(new RetentionError(null, null, "Sweep aborted: " + e.getMessage())),
                            clock.millis() - start, now.plusHours(retentionProperties.getIntervalHours())));
                });
    }

    /**
     * The object goes first: a slide is only marked deleted once its file is gone,
     * otherwise it stays eligible for the next run. A missing object counts as deleted.
     */
    private Mono<Outcome> purge(Slide slide) {
        return objectStorageService.objectExists(slide.getStorageKey())
                .flatMap(exists -> {
                    if (!exists) {
                        log.debug("Object {} already absent for slide {}", slide.getStorageKey(), slide.getId());
                        return Mono.<Void>empty();
                    }
                    return objectStorageService.deleteObject(slide.getStorageKey());
                })
                .then(Mono.defer(() -> slideDAO.markDeleted(slide.getId(), OffsetDateTime.now(clock))))
                .map(rows -> new Outcome(rows > 0, null))
                .onErrorResume(e -> {
                    log.error("Failed to purge slide {} ({})", slide.getId(), slide.getStorageKey(), e);
                    Outcome failed = new Outcome(false, new RetentionError(slide.getId(), slide.getStorageKey(), e.getMessage()));
                    return slideDAO.markPurgeFailed(slide.getId(), OffsetDateTime.now(clock))
                            .onErrorResume(markError -> {
                                log.warn("Could not record purge failure for slide {}: {}", slide.getId(), markError.getMessage());
                                return Mono.empty();
                            })
                            .thenReturn(failed);
                });
    }

    private record Outcome(boolean deleted, RetentionError error) {
    }
}
