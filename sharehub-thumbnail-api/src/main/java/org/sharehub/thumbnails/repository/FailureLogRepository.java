package org.sharehub.thumbnails.repository;

import org.sharehub.thumbnails.entity.ThumbnailFailureLog;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only access to the thumbnail failure log
 */
public interface FailureLogRepository extends ReactiveCrudRepository<ThumbnailFailureLog, UUID> {

    /**
     * Count failures recorded for an event since the given instant
     *
     * @param eventId Event ID
     * @param since   Lower bound, inclusive
     * @return number of failures
     */
    Mono<Long> countByEventIdAndOccurredAtGreaterThanEqual(UUID eventId, OffsetDateTime since);

    Flux<ThumbnailFailureLog> findTop10ByEventIdAndOccurredAtGreaterThanEqualOrderByOccurredAtDesc(UUID eventId, OffsetDateTime since);
}
