package org.sharehub.thumbnails.repository.impl;

import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.sharehub.thumbnails.entity.Slide;
import org.sharehub.thumbnails.enums.ThumbnailStatus;
import org.sharehub.thumbnails.repository.SlideDAO;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static org.sharehub.thumbnails.entity.SqlColumnMapping.*;
import static org.sharehub.thumbnails.entity.SqlTableMapping.SLIDES;

@Service
@RequiredArgsConstructor
public class SlideDAOImpl implements SlideDAO {

    private static final String SLIDE_COLUMNS = """
            s.id, s.tenant_id, s.event_id, s.filename, s.storage_key, s.mime_type,
            s.thumbnail_status, s.thumbnail_key, s.thumbnail_generated_at, s.uploaded_at, s.deleted_at""";

    // Any status other than COMPLETED drops the previous thumbnail reference
    public static final String UPDATE_STATUS = "UPDATE " + SLIDES +
            " SET " + THUMBNAIL_STATUS + " = :status, " + THUMBNAIL_KEY + " = NULL, " + THUMBNAIL_GENERATED_AT + " = NULL" +
            " WHERE " + ID + " = :id";

    public static final String MARK_COMPLETED = "UPDATE " + SLIDES +
            " SET " + THUMBNAIL_STATUS + " = :status, " + THUMBNAIL_KEY + " = :key, " + THUMBNAIL_GENERATED_AT + " = :generatedAt" +
            " WHERE " + ID + " = :id";

    public static final String FIND_ELIGIBLE = "SELECT " + SLIDE_COLUMNS + """

            FROM slides s
            JOIN events e ON e.id = s.event_id
            WHERE s.deleted_at IS NULL
              AND s.thumbnail_key IS NULL
              AND s.thumbnail_status IN (:statuses)
              AND s.mime_type IN (:mimeTypes)
              AND s.uploaded_at >= :since
              AND e.thumbnail_generation_enabled = TRUE
            ORDER BY s.tenant_id, s.uploaded_at, s.id""";

    public static final String FIND_EXPIRED = "SELECT " + SLIDE_COLUMNS + """

            FROM slides s
            WHERE s.storage_key IS NOT NULL
              AND s.deleted_at IS NULL
              AND s.uploaded_at < :before
            ORDER BY s.purge_failed_at NULLS FIRST, s.uploaded_at
            LIMIT :limit""";

    public static final String MARK_DELETED = "UPDATE " + SLIDES + " SET " + DELETED_AT + " = :deletedAt" +
            " WHERE " + ID + " = :id AND " + DELETED_AT + " IS NULL";

    public static final String MARK_PURGE_FAILED = "UPDATE " + SLIDES + " SET " + PURGE_FAILED_AT + " = :failedAt" +
            " WHERE " + ID + " = :id";

    private static final List<String> RETRYABLE_STATUSES = List.of(ThumbnailStatus.NONE.name(), ThumbnailStatus.FAILED.name());

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Long> updateThumbnailStatus(UUID slideId, ThumbnailStatus status) {
        if (status == ThumbnailStatus.COMPLETED) {
            return Mono.error(new IllegalArgumentException("A completed thumbnail needs a key, use markThumbnailCompleted"));
        }
        return databaseClient.sql(UPDATE_STATUS)
                .bind("status", status.name())
                .bind(ID, slideId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Long> markThumbnailCompleted(UUID slideId, String thumbnailKey, OffsetDateTime generatedAt) {
        return databaseClient.sql(MARK_COMPLETED)
                .bind("status", ThumbnailStatus.COMPLETED.name())
                .bind("key", thumbnailKey)
                .bind("generatedAt", generatedAt)
                .bind(ID, slideId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Flux<Slide> findEligibleForThumbnail(OffsetDateTime uploadedSince, Collection<String> mimeTypes) {
        return databaseClient.sql(FIND_ELIGIBLE)
                .bind("statuses", RETRYABLE_STATUSES)
                .bind("mimeTypes", List.copyOf(mimeTypes))
                .bind("since", uploadedSince)
                .map(this::toSlide)
                .all();
    }

    @Override
    public Flux<Slide> findExpired(OffsetDateTime uploadedBefore, int limit) {
        return databaseClient.sql(FIND_EXPIRED)
                .bind("before", uploadedBefore)
                .bind("limit", limit)
                .map(this::toSlide)
                .all();
    }

    @Override
    public Mono<Long> markDeleted(UUID slideId, OffsetDateTime deletedAt) {
        return databaseClient.sql(MARK_DELETED)
                .bind("deletedAt", deletedAt)
                .bind(ID, slideId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Long> markPurgeFailed(UUID slideId, OffsetDateTime failedAt) {
        return databaseClient.sql(MARK_PURGE_FAILED)
                .bind("failedAt", failedAt)
                .bind(ID, slideId)
                .fetch()
                .rowsUpdated();
    }

    private Slide toSlide(Readable row) {
        return Slide.builder()
                .id(row.get(ID, UUID.class))
                .tenantId(row.get(TENANT_ID, UUID.class))
                .eventId(row.get(EVENT_ID, UUID.class))
                .filename(row.get(FILENAME, String.class))
                .storageKey(row.get(STORAGE_KEY, String.class))
                .mimeType(row.get(MIME_TYPE, String.class))
                .thumbnailStatus(ThumbnailStatus.valueOf(row.get(THUMBNAIL_STATUS, String.class)))
                .thumbnailKey(row.get(THUMBNAIL_KEY, String.class))
                .thumbnailGeneratedAt(row.get(THUMBNAIL_GENERATED_AT, OffsetDateTime.class))
                .uploadedAt(row.get(UPLOADED_AT, OffsetDateTime.class))
                .deletedAt(row.get(DELETED_AT, OffsetDateTime.class))
                .build();
    }
}
