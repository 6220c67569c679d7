package org.sharehub.thumbnails.repository;

import org.sharehub.thumbnails.entity.ConversionJob;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface ConversionJobRepository extends ReactiveCrudRepository<ConversionJob, UUID> {

    Mono<ConversionJob> findByExternalJobId(String externalJobId);

    Flux<ConversionJob> findBySlideIdOrderByStartedAtDesc(UUID slideId);
}
