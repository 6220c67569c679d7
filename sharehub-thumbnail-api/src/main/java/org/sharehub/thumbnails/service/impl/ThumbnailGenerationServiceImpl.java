package org.sharehub.thumbnails.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.RestApiVersion;
import org.sharehub.thumbnails.config.ThumbnailProperties;
import org.sharehub.thumbnails.dto.request.ConversionRequest;
import org.sharehub.thumbnails.dto.response.QuotaStatus;
import org.sharehub.thumbnails.dto.response.ThumbnailGenerationResult;
import org.sharehub.thumbnails.entity.ConversionJob;
import org.sharehub.thumbnails.entity.Slide;
import org.sharehub.thumbnails.enums.FailureType;
import org.sharehub.thumbnails.enums.InputFormat;
import org.sharehub.thumbnails.enums.JobStatus;
import org.sharehub.thumbnails.enums.ThumbnailStatus;
import org.sharehub.thumbnails.exception.EventNotFoundException;
import org.sharehub.thumbnails.exception.SlideNotFoundException;
import org.sharehub.thumbnails.exception.ThumbnailRetryConflictException;
import org.sharehub.thumbnails.repository.ConversionJobDAO;
import org.sharehub.thumbnails.repository.EventRepository;
import org.sharehub.thumbnails.repository.SlideDAO;
import org.sharehub.thumbnails.repository.SlideRepository;
import org.sharehub.thumbnails.service.*;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ThumbnailGenerationServiceImpl implements ThumbnailGenerationService {

    static final String SUPERSEDED_MESSAGE = "Superseded by retry";

    static final String WEBHOOK_PATH = RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_WEBHOOKS + "/conversion";

    private final EventRepository eventRepository;
    private final SlideRepository slideRepository;
    private final SlideDAO slideDAO;
    private final ConversionJobDAO conversionJobDAO;
    private final QuotaService quotaService;
    private final ObjectStorageService objectStorageService;
    private final ConversionClient conversionClient;
    private final FailureLogService failureLogService;
    private final FailureNotificationTrigger failureNotificationTrigger;
    private final ThumbnailProperties thumbnailProperties;
    private final Clock clock;

    @Override
    public Mono<ThumbnailGenerationResult> submit(UUID slideId, UUID tenantId, UUID eventId) {
        return eventRepository.findById(eventId)
                .filter(event -> tenantId.equals(event.getTenantId()))
                .switchIfEmpty(Mono.error(new EventNotFoundException(eventId)))
                .flatMap(event -> {
                    if (!event.isThumbnailGenerationEnabled()) {
                        log.info("Thumbnail generation disabled for event {}, slide {} skipped", eventId, slideId);
                        return Mono.just(ThumbnailGenerationResult.disabled());
                    }
                    return slideRepository.findById(slideId)
                            .filter(slide -> tenantId.equals(slide.getTenantId()) && eventId.equals(slide.getEventId()))
                            .switchIfEmpty(Mono.error(new SlideNotFoundException(slideId)))
                            .flatMap(this::submitSlide);
                });
    }

    @Override
    public Mono<ThumbnailGenerationResult> retry(UUID slideId) {
        return slideRepository.findById(slideId)
                .switchIfEmpty(Mono.error(new SlideNotFoundException(slideId)))
                .flatMap(slide -> conversionJobDAO.findOpenBySlideId(slideId)
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(openJob -> {
                            if (openJob.isPresent() && !isStale(openJob.get())) {
                                return Mono.error(new ThumbnailRetryConflictException(slideId));
                            }
                            if (openJob.isEmpty() && slide.getThumbnailStatus() != null && slide.getThumbnailStatus().isInFlight()) {
                                log.warn("Slide {} is {} without an open conversion job", slideId, slide.getThumbnailStatus());
                            }
                            log.info("Retrying thumbnail generation for slide {} (was {})", slideId, slide.getThumbnailStatus());
                            return openJob.map(this::supersede).orElse(Mono.empty())
                                    .then(slideDAO.updateThumbnailStatus(slideId, ThumbnailStatus.NONE))
                                    .then(Mono.defer(() -> submit(slideId, slide.getTenantId(), slide.getEventId())));
                        }));
    }

    private boolean isStale(ConversionJob job) {
        OffsetDateTime staleBefore = OffsetDateTime.now(clock).minus(thumbnailProperties.getStaleJobAfter());
        return job.getStartedAt() == null || job.getStartedAt().isBefore(staleBefore);
    }

    /**
     * Closes a job whose webhook never came, so a late callback for it is ignored.
     */
    private Mono<Void> supersede(ConversionJob job) {
        log.warn("Conversion job {} for slide {} started at {} without a webhook, superseding it",
                job.getExternalJobId(), job.getSlideId(), job.getStartedAt());
        return conversionJobDAO.markTerminal(job.getId(), JobStatus.FAILED, SUPERSEDED_MESSAGE, OffsetDateTime.now(clock))
                .doOnNext(applied -> {
                    if (!applied) {
                        log.info("Webhook for job {} arrived while superseding it", job.getExternalJobId());
                    }
                })
                .then();
    }

    private Mono<ThumbnailGenerationResult> submitSlide(Slide slide) {
        if (slide.isDeleted()) {
            log.warn("Slide {} has been deleted, no thumbnail generated", slide.getId());
            return Mono.just(ThumbnailGenerationResult.failed("Slide has been deleted"));
        }
        Optional<InputFormat> format = InputFormat.fromMimeType(slide.getMimeType());
        if (format.isEmpty()) {
            log.warn("Unsupported file type {} for slide {}", slide.getMimeType(), slide.getId());
            return Mono.just(ThumbnailGenerationResult.failed("Unsupported file type: " + slide.getMimeType()));
        }
        if (slide.getStorageKey() == null) {
            log.warn("Slide {} has no stored file", slide.getId());
            return Mono.just(ThumbnailGenerationResult.failed("Slide has no stored file"));
        }
        if (slide.hasThumbnail()) {
            return quotaService.status(slide.getTenantId())
                    .map(ThumbnailGenerationResult::completed);
        }
        return quotaService.reserve(slide.getTenantId())
                .flatMap(quota -> {
                    if (!quota.available()) {
                        return Mono.just(ThumbnailGenerationResult.quotaExhausted(quota, thumbnailProperties.getUpgradeUrl()));
                    }
                    return startConversion(slide, format.get(), quota);
                });
    }

    /**
     * Runs once the quota is reserved. Until the job is accepted every failure gives the reservation back;
     * after that the reservation stands, whatever happens to the local bookkeeping.
     */
    private Mono<ThumbnailGenerationResult> startConversion(Slide slide, InputFormat format, QuotaStatus quota) {
        log.info("Submitting thumbnail conversion for slide {} ({}), tenant quota {}/{}",
                slide.getId(), format, quota.used(), quota.total());
        return objectStorageService.signDownloadUrl(slide.getStorageKey(), thumbnailProperties.getSignedUrlTtl())
                .onErrorResume(e -> {
                    log.error("Failed to sign download URL for slide {}", slide.getId(), e);
                    return rollback(slide).then(Mono.error(new SigningFailure(e)));
                })
                .flatMap(sourceUrl -> conversionClient.submit(conversionRequest(slide, format, sourceUrl))
                        .flatMap(jobId -> recordSubmission(slide, jobId)
                                .thenReturn(ThumbnailGenerationResult.processing(jobId, quota)))
                        .onErrorResume(e -> submissionFailed(slide, e)))
                .onErrorResume(SigningFailure.class, e -> Mono.just(
                        ThumbnailGenerationResult.failed("Failed to generate download URL: " + describe(e.getCause()))));
    }

    private Mono<ThumbnailGenerationResult> submissionFailed(Slide slide, Throwable e) {
        log.error("Conversion submission failed for slide {}", slide.getId(), e);
        String message = describe(e);
        return rollback(slide)
                .then(failureLogService.record(slide.getTenantId(), slide.getEventId(), slide.getId(),
                        FailureType.EXTERNAL_SUBMISSION_ERROR, message))
                .then(failureNotificationTrigger.evaluate(slide.getTenantId(), slide.getEventId()))
                .thenReturn(ThumbnailGenerationResult.failed(message));
    }

    private Mono<Void> rollback(Slide slide) {
        return quotaService.rollback(slide.getTenantId())
                .onErrorResume(e -> {
                    log.error("Quota rollback failed for tenant {} (slide {})", slide.getTenantId(), slide.getId(), e);
                    return Mono.empty();
                });
    }

    private Mono<Void> recordSubmission(Slide slide, String externalJobId) {
        ConversionJob job = ConversionJob.builder()
                .tenantId(slide.getTenantId())
                .slideId(slide.getId())
                .externalJobId(externalJobId)
                .status(JobStatus.PENDING)
                .idempotencyKey(UUID.randomUUID().toString())
                .startedAt(OffsetDateTime.now(clock))
                .build();
        Mono<Void> markProcessing = slideDAO.updateThumbnailStatus(slide.getId(), ThumbnailStatus.PROCESSING)
                .then()
                .onErrorResume(e -> {
                    log.warn("Could not mark slide {} as processing: {}", slide.getId(), e.getMessage());
                    return Mono.empty();
                });
        Mono<Void> createJob = conversionJobDAO.create(job)
                .then()
                .onErrorResume(e -> {
                    log.warn("Could not record conversion job {} for slide {}: {}", externalJobId, slide.getId(), e.getMessage());
                    return Mono.empty();
                });
        return markProcessing.then(createJob);
    }

    private ConversionRequest conversionRequest(Slide slide, InputFormat format, String sourceUrl) {
        String callbackUrl = UriComponentsBuilder.fromHttpUrl(thumbnailProperties.getCallbackBaseUrl())
                .path(WEBHOOK_PATH)
                .queryParam("slideId", slide.getId())
                .queryParam("tenantId", slide.getTenantId())
                .build()
                .toUriString();
        return new ConversionRequest(slide.getId(), slide.getTenantId(), sourceUrl, format,
                thumbnailProperties.outputFilename(slide.getId()), callbackUrl);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static final class SigningFailure extends RuntimeException {
        SigningFailure(Throwable cause) {
            super(describe(cause), cause);
        }
    }
}
