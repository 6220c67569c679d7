package org.sharehub.thumbnails.service;

import org.sharehub.thumbnails.dto.response.ThumbnailGenerationResult;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Starts thumbnail conversions for uploaded slides.
 */
public interface ThumbnailGenerationService {

    /**
     * Runs one submission attempt for the slide: policy checks, quota reservation,
     * then the conversion job. Policy rejections and infrastructure failures are reported
     * in the result; unknown slides and events are errors.
     */
    Mono<ThumbnailGenerationResult> submit(UUID slideId, UUID tenantId, UUID eventId);

    /**
     * Clears the current thumbnail state of the slide and submits it again.
     * Fails with a conflict while a conversion is in flight.
     */
    Mono<ThumbnailGenerationResult> retry(UUID slideId);
}
