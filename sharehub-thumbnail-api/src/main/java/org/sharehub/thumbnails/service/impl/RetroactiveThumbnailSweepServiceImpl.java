package org.sharehub.thumbnails.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.ThumbnailProperties;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import org.sharehub.thumbnails.dto.response.RetroactiveSweepResult;
import org.sharehub.thumbnails.dto.response.ThumbnailGenerationResult;
import org.sharehub.thumbnails.entity.Slide;
import org.sharehub.thumbnails.enums.GenerationStatus;
import org.sharehub.thumbnails.enums.InputFormat;
import org.sharehub.thumbnails.repository.SlideDAO;
import org.sharehub.thumbnails.service.QuotaService;
import org.sharehub.thumbnails.service.RetroactiveThumbnailSweepService;
import org.sharehub.thumbnails.service.ThumbnailGenerationService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Walks the eligible slides tenant by tenant, in upload order.
 * Each tenant gets at most max-per-tenant attempts and the whole run at most max-per-run,
 * so one large tenant cannot starve the others. Quota is only ever reserved by the submission itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetroactiveThumbnailSweepServiceImpl implements RetroactiveThumbnailSweepService {

    private static final List<String> SUPPORTED_MIME_TYPES = Arrays.stream(InputFormat.values())
            .map(InputFormat::getMimeType)
            .toList();

    private final SlideDAO slideDAO;
    private final QuotaService quotaService;
    private final ThumbnailGenerationService thumbnailGenerationService;
    private final ThumbnailProperties thumbnailProperties;
    private final Clock clock;

    @Override
    public Mono<RetroactiveSweepResult> run() {
        long start = clock.millis();
        ThumbnailProperties.Sweep sweep = thumbnailProperties.getSweep();
        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(sweep.getLookBackDays());

        return slideDAO.findEligibleForThumbnail(since, SUPPORTED_MIME_TYPES)
                .collectList()
                .flatMap(slides -> {
                    log.info("Retroactive thumbnail sweep: {} eligible slides", slides.size());
                    Map<UUID, List<Slide>> byTenant = slides.stream()
                            .collect(Collectors.groupingBy(Slide::getTenantId, LinkedHashMap::new, Collectors.toList()));
                    Tally tally = new Tally(slides.size());
                    return Flux.fromIterable(byTenant.entrySet())
                            .concatMap(entry -> sweepTenant(entry.getKey(), entry.getValue(), tally, sweep))
                            .then(Mono.fromCallable(() -> tally.toResult(clock.millis() - start)));
                })
                .doOnNext(result -> log.info("Retroactive thumbnail sweep completed: total={}, processed={}, skipped={}, failed={}, quotaExhausted={}, duration={}ms",
                        result.totalSlides(), result.processed(), result.skipped(), result.failed(),
                        result.quotaExhausted(), result.durationMs()))
                .onErrorResume(e -> {
                    log.error("Retroactive thumbnail sweep aborted", e);
                    return Mono.just(new RetroactiveSweepResult(0, 0, 0, 0, 0,
                            List.of("Sweep aborted: " + e.getMessage()), clock.millis() - start));
                });
    }

    private Mono<Void> sweepTenant(UUID tenantId, List<Slide> slides, Tally tally, ThumbnailProperties.Sweep sweep) {
        return quotaService.status(tenantId)
                .map(QuotaStatus::available)
                .onErrorResume(e -> {
                    log.warn("Could not read thumbnail quota of tenant {}: {}", tenantId, e.getMessage());
                    return Mono.just(false);
                })
                .flatMap(hasQuota -> {
                    if (!hasQuota) {
                        log.info("Tenant {} has no thumbnail quota left, {} slides skipped", tenantId, slides.size());
                        tally.skipped += slides.size();
                        return Mono.empty();
                    }
                    return sweepSlides(tenantId, slides, 0, tally, sweep);
                });
    }

    private Mono<Void> sweepSlides(UUID tenantId, List<Slide> slides, int index, Tally tally, ThumbnailProperties.Sweep sweep) {
        if (index >= slides.size()) {
            return Mono.empty();
        }
        if (index >= sweep.getMaxPerTenant() || tally.attempts >= sweep.getMaxPerRun()) {
            tally.skipped += slides.size() - index;
            return Mono.empty();
        }
        Slide slide = slides.get(index);
        Mono<Void> pause = tally.attempts > 0 ? pause(sweep.getDelay()) : Mono.empty();
        tally.attempts++;
        return pause
                .then(Mono.defer(() -> thumbnailGenerationService.submit(slide.getId(), slide.getTenantId(), slide.getEventId())))
                .onErrorResume(e -> Mono.just(ThumbnailGenerationResult.failed(e.getMessage())))
                .flatMap(result -> {
                    if (result.success()) {
                        tally.processed++;
                        log.debug("Slide {} submitted ({})", slide.getId(), result.status());
                    } else if (result.status() == GenerationStatus.QUOTA_EXHAUSTED) {
                        tally.quotaExhausted++;
                        tally.skipped += slides.size() - index - 1;
                        log.info("Thumbnail quota of tenant {} exhausted, moving to next tenant", tenantId);
                        return Mono.empty();
                    } else {
                        tally.failed++;
                        tally.errors.add("Slide " + slide.getId() + ": " + result.message());
                        log.warn("Slide {} not submitted: {}", slide.getId(), result.message());
                    }
                    return sweepSlides(tenantId, slides, index + 1, tally, sweep);
                });
    }

    private static Mono<Void> pause(Duration delay) {
        if (delay.isZero()) {
            return Mono.empty();
        }
        return Mono.delay(delay).then();
    }

    // Mutated only from the sequential concatMap chain of a single run
    private static final class Tally {
        private final int total;
        private int attempts;
        private int processed;
        private int skipped;
        private int failed;
        private int quotaExhausted;
        private final List<String> errors = new ArrayList<>();

        private Tally(int total) {
            this.total = total;
        }

        private RetroactiveSweepResult toResult(long durationMs) {
            return new RetroactiveSweepResult(total, processed, skipped, failed, quotaExhausted, List.copyOf(errors), durationMs);
        }
    }
}
