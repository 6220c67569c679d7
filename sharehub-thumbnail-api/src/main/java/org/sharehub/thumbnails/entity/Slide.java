package org.sharehub.thumbnails.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.sharehub.thumbnails.enums.ThumbnailStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.sharehub.thumbnails.entity.SqlColumnMapping.*;
import static org.sharehub.thumbnails.entity.SqlTableMapping.SLIDES;

/**
 * An uploaded presentation file. Thumbnail columns are owned by this service,
 * the rest is written by the upload flow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(SLIDES)
public class Slide {

    @Id
    @Column(ID)
    private UUID id;

    @Column(TENANT_ID)
    private UUID tenantId;

    @Column(EVENT_ID)
    private UUID eventId;

    @Column(FILENAME)
    private String filename;

    @Column(STORAGE_KEY)
    private String storageKey; // Object key in the slides bucket, null once purged

    @Column(MIME_TYPE)
    private String mimeType;

    @Column(THUMBNAIL_STATUS)
    private ThumbnailStatus thumbnailStatus;

    @Column(THUMBNAIL_KEY)
    private String thumbnailKey;

    @Column(THUMBNAIL_GENERATED_AT)
    private OffsetDateTime thumbnailGeneratedAt;

    @Column(UPLOADED_AT)
    private OffsetDateTime uploadedAt;

    @Column(DELETED_AT)
    private OffsetDateTime deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean hasThumbnail() {
        return thumbnailStatus == ThumbnailStatus.COMPLETED && thumbnailKey != null;
    }
}
