package org.sharehub.thumbnails.repository;

import org.sharehub.thumbnails.entity.ConversionJob;
import org.sharehub.thumbnails.enums.JobStatus;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface ConversionJobDAO {

    Mono<ConversionJob> create(ConversionJob job);

    Mono<ConversionJob> findByExternalId(String externalJobId);

    /**
     * Latest job of the slide still waiting for its webhook, if any.
     */
    Mono<ConversionJob> findOpenBySlideId(UUID slideId);

    /**
     * Moves the job to a terminal status, once.
     *
     * @return true when this call applied the transition, false when the webhook was already recorded
     */
    Mono<Boolean> markTerminal(UUID jobId, JobStatus status, String errorMessage, OffsetDateTime at);
}
