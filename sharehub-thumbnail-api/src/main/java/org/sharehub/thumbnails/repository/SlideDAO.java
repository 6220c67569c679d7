package org.sharehub.thumbnails.repository;

import org.sharehub.thumbnails.entity.Slide;
import org.sharehub.thumbnails.enums.ThumbnailStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.UUID;

public interface SlideDAO {

    /**
     * Moves the slide to a non-completed status, clearing any previous thumbnail reference.
     */
    Mono<Long> updateThumbnailStatus(UUID slideId, ThumbnailStatus status);

    Mono<Long> markThumbnailCompleted(UUID slideId, String thumbnailKey, OffsetDateTime generatedAt);

    /**
     * Slides without a thumbnail, in an enabled event, uploaded since the given instant,
     * ordered by tenant then upload time.
     */
    Flux<Slide> findEligibleForThumbnail(OffsetDateTime uploadedSince, Collection<String> mimeTypes);

    /**
     * Slides still holding a stored object and uploaded before the given instant, oldest first.
     * Slides whose last purge failed come after the others, least recently failed first.
     */
    Flux<Slide> findExpired(OffsetDateTime uploadedBefore, int limit);

    Mono<Long> markDeleted(UUID slideId, OffsetDateTime deletedAt);

    Mono<Long> markPurgeFailed(UUID slideId, OffsetDateTime failedAt);
}
