package org.sharehub.thumbnails.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sharehub.thumbnails.config.ThumbnailProperties;
import org.sharehub.thumbnails.dto.response.WebhookResult;
import org.sharehub.thumbnails.dto.webhook.CloudConvertWebhookPayload;
import org.sharehub.thumbnails.entity.ConversionJob;
import org.sharehub.thumbnails.entity.Slide;
import org.sharehub.thumbnails.enums.FailureType;
import org.sharehub.thumbnails.enums.JobStatus;
import org.sharehub.thumbnails.enums.ThumbnailStatus;
import org.sharehub.thumbnails.exception.ConversionJobNotFoundException;
import org.sharehub.thumbnails.exception.InvalidWebhookPayloadException;
import org.sharehub.thumbnails.exception.InvalidWebhookSignatureException;
import org.sharehub.thumbnails.exception.SlideNotFoundException;
import org.sharehub.thumbnails.repository.ConversionJobDAO;
import org.sharehub.thumbnails.repository.SlideDAO;
import org.sharehub.thumbnails.repository.SlideRepository;
import org.sharehub.thumbnails.service.*;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionWebhookServiceImpl implements ConversionWebhookService {

    static final String DEFAULT_FAILURE_MESSAGE = "CloudConvert job failed";
    static final String MISSING_URL_MESSAGE = "No thumbnail URL in webhook payload";

    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final ConversionJobDAO conversionJobDAO;
    private final SlideRepository slideRepository;
    private final SlideDAO slideDAO;
    private final ConversionClient conversionClient;
    private final ObjectStorageService objectStorageService;
    private final FailureLogService failureLogService;
    private final FailureNotificationTrigger failureNotificationTrigger;
    private final ThumbnailProperties thumbnailProperties;
    private final Clock clock;

    @Override
    public Mono<WebhookResult> handle(byte[] rawPayload, String signature, UUID callbackSlideId) {
        // Nothing from the body is read before the signature is checked
        if (!signatureVerifier.isValid(rawPayload, signature)) {
            return Mono.error(new InvalidWebhookSignatureException());
        }
        CloudConvertWebhookPayload payload;
        try {
            payload = objectMapper.readValue(rawPayload, CloudConvertWebhookPayload.class);
        } catch (IOException e) {
            return Mono.error(new InvalidWebhookPayloadException("Malformed webhook payload", e));
        }
        if (payload.job() == null || payload.job().id() == null || payload.job().id().isBlank()) {
            return Mono.error(new InvalidWebhookPayloadException("Webhook payload carries no job id"));
        }
        String externalJobId = payload.job().id();
        log.debug("Webhook {} received for job {}", payload.event(), externalJobId);

        return conversionJobDAO.findByExternalId(externalJobId)
                .switchIfEmpty(Mono.error(new ConversionJobNotFoundException(externalJobId)))
                .flatMap(job -> {
                    if (callbackSlideId != null && !callbackSlideId.equals(job.getSlideId())) {
                        return Mono.error(new InvalidWebhookPayloadException(
                                "Callback slide " + callbackSlideId + " does not match conversion job " + externalJobId));
                    }
                    if (job.isWebhookReceived()) {
                        log.info("Webhook already processed for job {}", externalJobId);
                        return Mono.just(WebhookResult.alreadyProcessed(externalJobId));
                    }
                    if (payload.isSuccess()) {
                        return findSlide(job).flatMap(slide -> handleSuccess(job, slide, payload));
                    }
                    if (payload.isFailure()) {
                        String message = payload.errorMessage().orElse(DEFAULT_FAILURE_MESSAGE);
                        return findSlide(job).flatMap(slide ->
                                handleFailure(job, slide, message, FailureType.EXTERNAL_CONVERSION_ERROR));
                    }
                    log.debug("Webhook {} for job {} needs no action", payload.event(), externalJobId);
                    return Mono.just(WebhookResult.acknowledged(externalJobId, payload.event()));
                });
    }

    private Mono<Slide> findSlide(ConversionJob job) {
        return slideRepository.findById(job.getSlideId())
                .switchIfEmpty(Mono.error(new SlideNotFoundException(job.getSlideId())));
    }

    private Mono<WebhookResult> handleSuccess(ConversionJob job, Slide slide, CloudConvertWebhookPayload payload) {
        Optional<String> url = payload.exportUrl();
        if (url.isEmpty()) {
            log.error("Job {} finished without an exported file", job.getExternalJobId());
            return handleFailure(job, slide, MISSING_URL_MESSAGE, FailureType.THUMBNAIL_STORAGE_ERROR);
        }
        String thumbnailKey = thumbnailProperties.thumbnailKey(slide.getTenantId(), slide.getEventId(), slide.getId());
        return storeThumbnail(url.get(), thumbnailKey)
                .then(Mono.defer(() -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    return slideDAO.markThumbnailCompleted(slide.getId(), thumbnailKey, now)
                            .then(conversionJobDAO.markTerminal(job.getId(), JobStatus.COMPLETED, null, now));
                }))
                .map(applied -> {
                    if (!applied) {
                        log.info("Job {} was completed by a concurrent delivery", job.getExternalJobId());
                        return WebhookResult.alreadyProcessed(job.getExternalJobId());
                    }
                    log.info("Thumbnail generated for slide {} ({})", slide.getId(), thumbnailKey);
                    return WebhookResult.processed(job.getExternalJobId(), ThumbnailStatus.COMPLETED);
                })
                .onErrorResume(ThumbnailStoreFailure.class, e ->
                        handleFailure(job, slide, e.getMessage(), FailureType.THUMBNAIL_STORAGE_ERROR));
    }

    private Mono<Void> storeThumbnail(String url, String thumbnailKey) {
        return conversionClient.downloadResult(url)
                .flatMap(bytes -> objectStorageService.putObject(thumbnailKey, bytes, MediaType.IMAGE_JPEG_VALUE))
                .onErrorMap(e -> {
                    log.error("Failed to store thumbnail {}", thumbnailKey, e);
                    return new ThumbnailStoreFailure("Failed to store thumbnail: " + e.getMessage(), e);
                });
    }

    private Mono<WebhookResult> handleFailure(ConversionJob job, Slide slide, String message, FailureType type) {
        log.warn("Thumbnail conversion failed for slide {} (job {}): {}", slide.getId(), job.getExternalJobId(), message);
        // The quota stays charged: the conversion service did the work
        return slideDAO.updateThumbnailStatus(slide.getId(), ThumbnailStatus.FAILED)
                .then(Mono.defer(() -> conversionJobDAO.markTerminal(job.getId(), JobStatus.FAILED, message, OffsetDateTime.now(clock))))
                .flatMap(applied -> {
                    if (!applied) {
                        return Mono.just(WebhookResult.alreadyProcessed(job.getExternalJobId()));
                    }
                    return failureLogService.record(slide.getTenantId(), slide.getEventId(), slide.getId(), type, message)
                            .then(failureNotificationTrigger.evaluate(slide.getTenantId(), slide.getEventId()))
                            .thenReturn(WebhookResult.processed(job.getExternalJobId(), ThumbnailStatus.FAILED));
                });
    }

    private static final class ThumbnailStoreFailure extends RuntimeException {
        ThumbnailStoreFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
